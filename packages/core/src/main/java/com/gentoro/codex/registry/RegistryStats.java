package com.gentoro.codex.registry;

import com.gentoro.codex.storage.StoreStats;
import java.util.Map;

public record RegistryStats(
    long iceNodes,
    long waterNodes,
    long gasNodes,
    long edges,
    Map<String, Long> nodesByType,
    StoreStats iceBackend,
    StoreStats waterBackend) {

  public RegistryStats {
    nodesByType = nodesByType == null ? Map.of() : Map.copyOf(nodesByType);
  }

  public long totalNodes() {
    return iceNodes + waterNodes + gasNodes;
  }
}
