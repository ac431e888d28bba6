package com.gentoro.codex.graph;

/**
 * Lifecycle state of a node. The state decides which storage tier holds the node.
 *
 * <ul>
 *   <li>{@link #ICE}: durable, canonical.
 *   <li>{@link #WATER}: working set, may carry an expiry hint.
 *   <li>{@link #GAS}: retired; kept in the water tier for audit, hidden from type listings.
 * </ul>
 */
public enum ContentState {
  ICE,
  WATER,
  GAS;

  public boolean isIceTier() {
    return this == ICE;
  }
}
