package com.gentoro.codex.storage;

import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.EdgeKey;
import java.util.List;

/** Persistence behind the registry's adjacency index. */
public interface EdgeStore extends AutoCloseable {

  void initialize();

  void put(Edge edge);

  boolean delete(EdgeKey key);

  List<Edge> listAll();

  long count();

  @Override
  void close();
}
