package com.gentoro.codex.registry;

import com.gentoro.codex.exception.NotFoundException;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.EdgeKey;
import com.gentoro.codex.graph.GraphValidator;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.graph.NodeExpiry;
import com.gentoro.codex.graph.StateTransitions;
import com.gentoro.codex.storage.EdgeStore;
import com.gentoro.codex.storage.IceStore;
import com.gentoro.codex.storage.WaterStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link NodeRegistry} backed by an ice store (ICE nodes), a water store (WATER and GAS nodes) and
 * an edge store.
 *
 * <p>Writes to one node id are serialised by a striped lock; reads take no lock. When a node
 * changes tier the destination is written before the source is removed. Reads consult ice, then
 * water, then ice again on a double miss, so a concurrent reader always finds the node.
 */
public class TieredNodeRegistry implements NodeRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(TieredNodeRegistry.class);

  private final IceStore ice;
  private final WaterStore water;
  private final EdgeStore edgeStore;
  private final GasRetentionPolicy gasRetention;
  private final Clock clock;
  private final NodeLocks locks = new NodeLocks();

  private final Map<String, Map<EdgeKey, Edge>> outgoing = new ConcurrentHashMap<>();
  private final Map<String, Map<EdgeKey, Edge>> incoming = new ConcurrentHashMap<>();

  public TieredNodeRegistry(IceStore ice, WaterStore water, EdgeStore edgeStore) {
    this(ice, water, edgeStore, GasRetentionPolicy.retain(), Clock.systemUTC());
  }

  public TieredNodeRegistry(
      IceStore ice,
      WaterStore water,
      EdgeStore edgeStore,
      GasRetentionPolicy gasRetention,
      Clock clock) {
    this.ice = Objects.requireNonNull(ice, "ice");
    this.water = Objects.requireNonNull(water, "water");
    this.edgeStore = Objects.requireNonNull(edgeStore, "edgeStore");
    this.gasRetention = Objects.requireNonNull(gasRetention, "gasRetention");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void initialize() {
    ice.initialize();
    water.initialize();
    edgeStore.initialize();
    outgoing.clear();
    incoming.clear();
    for (Edge e : edgeStore.listAll()) {
      index(e);
    }
    log.info(
        "Registry initialized: ice={}, water={}, edges={} (gas retention: {})",
        ice.stats().nodeCount(),
        water.stats().nodeCount(),
        edgeStore.count(),
        gasRetention);
  }

  // ---------------------------------------------------------------------------------------------
  // Nodes
  // ---------------------------------------------------------------------------------------------

  @Override
  public Node upsert(Node node) {
    GraphValidator.validate(node);
    return locks.withLock(node.id(), () -> write(node));
  }

  private Node write(Node node) {
    Optional<Node> current = get(node.id());
    ContentState from = current.map(Node::state).orElse(null);
    ContentState to = node.state();
    StateTransitions.check(node.id(), from, to);

    Node toStore = node;
    if (to == ContentState.GAS && node.metaValue(MetaSchema.GAS_SINCE) == null) {
      Object since =
          from == ContentState.GAS ? current.get().metaValue(MetaSchema.GAS_SINCE) : null;
      toStore =
          node.withMetaEntry(
              MetaSchema.GAS_SINCE, since != null ? since : clock.instant().toString());
    }

    switch (to) {
      case ICE -> {
        ice.put(toStore);
        if (from == ContentState.WATER) {
          water.delete(node.id());
          log.debug("Promoted node '{}' from water to ice", node.id());
        }
      }
      case WATER -> water.put(toStore);
      case GAS -> {
        water.put(toStore);
        if (from == ContentState.ICE) {
          ice.delete(node.id());
        }
        if (from != ContentState.GAS) {
          log.debug("Node '{}' moved {} -> GAS", node.id(), from);
        }
      }
    }
    return toStore;
  }

  @Override
  public Optional<Node> get(String id) {
    if (id == null) return Optional.empty();
    Optional<Node> found = ice.get(id);
    if (found.isPresent()) return found;
    found = water.get(id);
    if (found.isPresent()) return found;
    // a promotion may have completed between the two lookups
    return ice.get(id);
  }

  @Override
  public List<Node> getNodesByType(String typeId) {
    // water first: a node promoted between the two listings then still shows up in ice
    Map<String, Node> byId = new LinkedHashMap<>();
    for (Node n : water.listByType(typeId)) {
      if (n.state() != ContentState.GAS) {
        byId.put(n.id(), n);
      }
    }
    for (Node n : ice.listByType(typeId)) {
      byId.put(n.id(), n);
    }
    return byId.values().stream().sorted(Comparator.comparing(Node::id)).toList();
  }

  @Override
  public List<Node> getNodesByState(ContentState state) {
    Objects.requireNonNull(state, "state");
    if (state == ContentState.ICE) {
      return ice.listByState(state);
    }
    // a node mid-promotion may briefly exist in both tiers; ice wins
    return water.listByState(state).stream().filter(n -> ice.get(n.id()).isEmpty()).toList();
  }

  @Override
  public boolean delete(String id) {
    return locks.withLock(
        id,
        () -> {
          Optional<Node> current = get(id);
          if (current.isEmpty()) {
            return false;
          }
          if (current.get().state() != ContentState.GAS) {
            write(current.get().withState(ContentState.GAS));
          }
          return true;
        });
  }

  @Override
  public Node promote(String id) {
    return locks.withLock(
        id,
        () -> {
          Node current =
              get(id).orElseThrow(() -> new NotFoundException("No node with id '" + id + "'"));
          if (current.state() == ContentState.ICE) {
            return current;
          }
          return write(current.withState(ContentState.ICE));
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Edges
  // ---------------------------------------------------------------------------------------------

  @Override
  public Edge upsert(Edge edge) {
    GraphValidator.validate(edge);
    return locks.withLock(
        edge.fromId(),
        () -> {
          edgeStore.put(edge);
          index(edge);
          return edge;
        });
  }

  @Override
  public List<Edge> getEdgesFrom(String id) {
    return resolvable(outgoing.getOrDefault(id, Map.of()).values().stream());
  }

  @Override
  public List<Edge> getEdgesTo(String id) {
    return resolvable(incoming.getOrDefault(id, Map.of()).values().stream());
  }

  @Override
  public Optional<Edge> getEdge(String fromId, String toId, String role) {
    EdgeKey key = new EdgeKey(fromId, toId, role);
    return Optional.ofNullable(outgoing.getOrDefault(fromId, Map.of()).get(key));
  }

  private List<Edge> resolvable(Stream<Edge> edges) {
    return edges
        .filter(e -> get(e.fromId()).isPresent() && get(e.toId()).isPresent())
        .sorted(Comparator.comparing(Edge::key))
        .toList();
  }

  private void index(Edge e) {
    outgoing.computeIfAbsent(e.fromId(), k -> new ConcurrentHashMap<>()).put(e.key(), e);
    incoming.computeIfAbsent(e.toId(), k -> new ConcurrentHashMap<>()).put(e.key(), e);
  }

  private void unindex(EdgeKey key) {
    Map<EdgeKey, Edge> out = outgoing.get(key.fromId());
    if (out != null) out.remove(key);
    Map<EdgeKey, Edge> in = incoming.get(key.toId());
    if (in != null) in.remove(key);
  }

  /** Removes every edge touching {@code id}; returns how many were removed. */
  private int removeEdgesOf(String id) {
    List<EdgeKey> keys = new ArrayList<>();
    keys.addAll(outgoing.getOrDefault(id, Map.of()).keySet());
    keys.addAll(incoming.getOrDefault(id, Map.of()).keySet());
    int removed = 0;
    for (EdgeKey key : keys.stream().distinct().toList()) {
      if (edgeStore.delete(key)) {
        removed++;
      }
      unindex(key);
    }
    outgoing.remove(id);
    incoming.remove(id);
    return removed;
  }

  // ---------------------------------------------------------------------------------------------
  // Maintenance
  // ---------------------------------------------------------------------------------------------

  @Override
  public RegistryStats stats() {
    long iceCount = ice.listAll().size();
    long waterCount = 0;
    long gasCount = 0;
    Map<String, Long> byType = new TreeMap<>();
    for (Node n : ice.listAll()) {
      byType.merge(n.typeId(), 1L, Long::sum);
    }
    for (Node n : water.listAll()) {
      if (n.state() == ContentState.GAS) gasCount++;
      else waterCount++;
      byType.merge(n.typeId(), 1L, Long::sum);
    }
    return new RegistryStats(
        iceCount, waterCount, gasCount, edgeStore.count(), byType, ice.stats(), water.stats());
  }

  @Override
  public CleanupReport cleanupExpired() {
    Instant now = clock.instant();
    List<String> expired = new ArrayList<>();
    List<String> gas = new ArrayList<>();
    int[] edgesRemoved = {0};

    for (Node candidate : water.listExpired(now)) {
      locks.withLock(
          candidate.id(),
          () -> {
            // re-check under the lock: the node may have been refreshed or promoted meanwhile
            Optional<Node> current = water.get(candidate.id());
            if (current.isPresent()
                && current.get().state() == ContentState.WATER
                && NodeExpiry.isExpired(current.get(), now)) {
              water.delete(candidate.id());
              expired.add(candidate.id());
              if (ice.get(candidate.id()).isEmpty()) {
                edgesRemoved[0] += removeEdgesOf(candidate.id());
              }
            }
            return null;
          });
    }

    if (gasRetention.mode() != GasRetentionPolicy.Mode.RETAIN) {
      for (Node candidate : water.listByState(ContentState.GAS)) {
        locks.withLock(
            candidate.id(),
            () -> {
              Optional<Node> current = water.get(candidate.id());
              if (current.isPresent()
                  && current.get().state() == ContentState.GAS
                  && gasRetention.isPurgeable(current.get(), now)) {
                water.delete(candidate.id());
                gas.add(candidate.id());
                edgesRemoved[0] += removeEdgesOf(candidate.id());
              }
              return null;
            });
      }
    }

    CleanupReport report = new CleanupReport(expired, gas, edgesRemoved[0]);
    if (report.nodesRemoved() > 0) {
      log.info(
          "Cleanup removed {} expired and {} gas node(s), {} edge(s)",
          expired.size(),
          gas.size(),
          report.edgesRemoved());
    }
    return report;
  }

  @Override
  public void close() {
    try {
      ice.close();
    } finally {
      try {
        water.close();
      } finally {
        edgeStore.close();
      }
    }
  }
}
