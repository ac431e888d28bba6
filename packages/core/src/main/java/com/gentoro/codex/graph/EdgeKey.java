package com.gentoro.codex.graph;

import java.util.Comparator;

/** Identity of an edge: the (from, to, role) triple. */
public record EdgeKey(String fromId, String toId, String role) implements Comparable<EdgeKey> {

  private static final Comparator<EdgeKey> ORDER =
      Comparator.comparing(EdgeKey::fromId)
          .thenComparing(EdgeKey::role)
          .thenComparing(EdgeKey::toId);

  @Override
  public int compareTo(EdgeKey o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return fromId + " -[" + role + "]-> " + toId;
  }
}
