package com.gentoro.codex.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed, typed relation between two nodes. Re-upserting an edge with the same {@link #key()}
 * replaces it.
 */
public record Edge(
    String fromId, String toId, String role, double weight, Map<String, Object> meta) {

  public static final double DEFAULT_WEIGHT = 1.0;

  public Edge {
    meta =
        meta == null || meta.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }

  public Edge(String fromId, String toId, String role) {
    this(fromId, toId, role, DEFAULT_WEIGHT, null);
  }

  public Edge(String fromId, String toId, String role, double weight) {
    this(fromId, toId, role, weight, null);
  }

  public EdgeKey key() {
    return new EdgeKey(fromId, toId, role);
  }
}
