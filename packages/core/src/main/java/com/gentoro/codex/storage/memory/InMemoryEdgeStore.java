package com.gentoro.codex.storage.memory;

import com.gentoro.codex.exception.StorageUnavailableException;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.EdgeKey;
import com.gentoro.codex.storage.EdgeStore;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEdgeStore implements EdgeStore {
  private final Map<EdgeKey, Edge> edges = new ConcurrentHashMap<>();
  private volatile boolean closed;

  @Override
  public void initialize() {
    ensureOpen();
  }

  @Override
  public void put(Edge edge) {
    ensureOpen();
    edges.put(edge.key(), edge);
  }

  @Override
  public boolean delete(EdgeKey key) {
    ensureOpen();
    return edges.remove(key) != null;
  }

  @Override
  public List<Edge> listAll() {
    ensureOpen();
    return edges.values().stream().sorted(Comparator.comparing(Edge::key)).toList();
  }

  @Override
  public long count() {
    ensureOpen();
    return edges.size();
  }

  @Override
  public void close() {
    closed = true;
  }

  private void ensureOpen() {
    if (closed) {
      throw new StorageUnavailableException("InMemoryEdgeStore is closed");
    }
  }
}
