package com.gentoro.codex.registry;

import java.util.List;

/** Outcome of one {@link NodeRegistry#cleanupExpired()} pass. */
public record CleanupReport(List<String> expiredPurged, List<String> gasPurged, int edgesRemoved) {

  public CleanupReport {
    expiredPurged = List.copyOf(expiredPurged);
    gasPurged = List.copyOf(gasPurged);
  }

  public int nodesRemoved() {
    return expiredPurged.size() + gasPurged.size();
  }
}
