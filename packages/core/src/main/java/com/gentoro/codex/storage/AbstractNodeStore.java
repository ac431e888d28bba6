package com.gentoro.codex.storage;

import com.gentoro.codex.exception.StorageUnavailableException;
import com.gentoro.codex.exception.ValidationException;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Shared behaviour of node stores: an in-memory map of the tier's nodes plus write-through hooks
 * that durable backends override. Listings are sorted by id so callers see a stable order.
 */
public abstract class AbstractNodeStore implements NodeStore {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(AbstractNodeStore.class);

  private final String backendId;
  private final Set<ContentState> acceptedStates;
  protected final Map<String, Node> nodes = new ConcurrentHashMap<>();
  private volatile boolean initialized;
  private volatile boolean closed;

  protected AbstractNodeStore(String backendId, Set<ContentState> acceptedStates) {
    this.backendId = Objects.requireNonNull(backendId, "backendId");
    this.acceptedStates = EnumSet.copyOf(acceptedStates);
  }

  /** Loads previously persisted nodes into {@code target}. */
  protected abstract void hydrate(Map<String, Node> target);

  /** Makes {@code node} durable before it becomes visible. */
  protected abstract void persist(Node node);

  /** Removes the durable copy of {@code id}. */
  protected abstract void erase(String id);

  @Override
  public synchronized void initialize() {
    ensureOpen();
    if (initialized) return;
    hydrate(nodes);
    initialized = true;
    log.debug("{} store initialized with {} node(s)", getClass().getSimpleName(), nodes.size());
  }

  @Override
  public Optional<Node> get(String id) {
    ensureOpen();
    return Optional.ofNullable(nodes.get(id));
  }

  @Override
  public void put(Node node) {
    ensureOpen();
    Objects.requireNonNull(node, "node");
    if (!acceptedStates.contains(node.state())) {
      throw new ValidationException(
          "%s does not accept %s nodes (node '%s')"
              .formatted(getClass().getSimpleName(), node.state(), node.id()),
          Map.of("nodeId", node.id(), "state", node.state().name()));
    }
    persist(node);
    nodes.put(node.id(), node);
  }

  @Override
  public boolean delete(String id) {
    ensureOpen();
    if (!nodes.containsKey(id)) {
      return false;
    }
    erase(id);
    return nodes.remove(id) != null;
  }

  @Override
  public List<Node> listByType(String typeId) {
    ensureOpen();
    return nodes.values().stream()
        .filter(n -> n.typeId().equals(typeId))
        .sorted(Comparator.comparing(Node::id))
        .toList();
  }

  @Override
  public List<Node> listByState(ContentState state) {
    ensureOpen();
    return nodes.values().stream()
        .filter(n -> n.state() == state)
        .sorted(Comparator.comparing(Node::id))
        .toList();
  }

  @Override
  public List<Node> listAll() {
    ensureOpen();
    return nodes.values().stream().sorted(Comparator.comparing(Node::id)).toList();
  }

  @Override
  public StoreStats stats() {
    ensureOpen();
    Map<String, Long> byType =
        nodes.values().stream()
            .collect(Collectors.groupingBy(Node::typeId, TreeMap::new, Collectors.counting()));
    return new StoreStats(backendId, nodes.size(), byType);
  }

  @Override
  public void close() {
    closed = true;
  }

  protected void ensureOpen() {
    if (closed) {
      throw new StorageUnavailableException(getClass().getSimpleName() + " is closed");
    }
  }
}
