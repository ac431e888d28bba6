package com.gentoro.codex.storage.file;

import com.gentoro.codex.exception.StorageUnavailableException;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.EdgeKey;
import com.gentoro.codex.storage.EdgeStore;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Edges persisted one file per (from, to, role) triple under {@code <rootDir>/edges}. */
public class FileEdgeStore implements EdgeStore {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(FileEdgeStore.class);

  private final JsonFileDirectory files;
  private final Map<EdgeKey, Edge> edges = new ConcurrentHashMap<>();
  private volatile boolean initialized;
  private volatile boolean closed;

  public FileEdgeStore(Path dir) {
    this.files = new JsonFileDirectory(dir);
  }

  @Override
  public synchronized void initialize() {
    ensureOpen();
    if (initialized) return;
    files.create();
    for (Edge e : files.readAll(Edge.class)) {
      edges.put(e.key(), e);
    }
    initialized = true;
    log.debug("Loaded {} edge(s) from {}", edges.size(), files.dir());
  }

  @Override
  public void put(Edge edge) {
    ensureOpen();
    files.write(fileKey(edge.key()), edge);
    edges.put(edge.key(), edge);
  }

  @Override
  public boolean delete(EdgeKey key) {
    ensureOpen();
    if (!edges.containsKey(key)) {
      return false;
    }
    files.delete(fileKey(key));
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

  private static String fileKey(EdgeKey key) {
    return key.fromId() + '\u0000' + key.role() + '\u0000' + key.toId();
  }

  private void ensureOpen() {
    if (closed) {
      throw new StorageUnavailableException("FileEdgeStore is closed");
    }
  }
}
