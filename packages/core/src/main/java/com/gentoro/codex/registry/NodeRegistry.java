package com.gentoro.codex.registry;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.Node;
import java.util.List;
import java.util.Optional;

/**
 * Unified read/write surface over the tiered node stores and the edge index. Callers never pick a
 * tier; the node's state does.
 */
public interface NodeRegistry extends AutoCloseable {

  /** Initializes the underlying stores and rebuilds the edge index. */
  void initialize();

  /**
   * Inserts or replaces a node, moving it between tiers when its state changes.
   *
   * @return the node as stored (the registry may add bookkeeping meta such as {@code gasSince})
   * @throws com.gentoro.codex.exception.ValidationException for malformed nodes
   * @throws com.gentoro.codex.exception.StateException for disallowed state transitions
   * @throws com.gentoro.codex.exception.StorageUnavailableException when a backend fails
   */
  Node upsert(Node node);

  /** Inserts or replaces the edge identified by its (from, to, role) triple. */
  Edge upsert(Edge edge);

  /** Looks up a node in the ice tier first, then the water tier. GAS nodes are returned. */
  Optional<Node> get(String id);

  /** Live (ICE and WATER) nodes of a type, sorted by id. */
  List<Node> getNodesByType(String typeId);

  /** Nodes in the given state, including GAS for auditing. */
  List<Node> getNodesByState(ContentState state);

  /** Outgoing edges whose endpoints both resolve, sorted. */
  List<Edge> getEdgesFrom(String id);

  /** Incoming edges whose endpoints both resolve, sorted. */
  List<Edge> getEdgesTo(String id);

  Optional<Edge> getEdge(String fromId, String toId, String role);

  /**
   * Logical delete: moves the node to GAS.
   *
   * @return {@code false} when the node does not exist
   */
  boolean delete(String id);

  /**
   * Promotes a WATER node to ICE.
   *
   * @throws com.gentoro.codex.exception.NotFoundException when the node does not exist
   */
  Node promote(String id);

  RegistryStats stats();

  /** Purges expired water nodes and applies the gas retention policy. Ice is never touched. */
  CleanupReport cleanupExpired();

  @Override
  void close();
}
