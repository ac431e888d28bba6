package com.gentoro.codex.storage;

import java.util.Map;

/** Point-in-time counters reported by a backend. */
public record StoreStats(String backend, long nodeCount, Map<String, Long> countsByType) {
  public StoreStats {
    countsByType = countsByType == null ? Map.of() : Map.copyOf(countsByType);
  }
}
