package com.gentoro.codex.storage;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for one storage tier. Every call either returns a definite result or throws {@link
 * com.gentoro.codex.exception.StorageUnavailableException}; a partially written node is never
 * observable.
 */
public interface NodeStore extends AutoCloseable {

  /** Prepares the backend (creates directories, hydrates caches). Idempotent. */
  void initialize();

  Optional<Node> get(String id);

  /** Inserts or replaces the node with the same id. */
  void put(Node node);

  /** Removes the node; returns whether it was present. */
  boolean delete(String id);

  List<Node> listByType(String typeId);

  List<Node> listByState(ContentState state);

  List<Node> listAll();

  StoreStats stats();

  @Override
  void close();
}
