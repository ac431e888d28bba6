package com.gentoro.codex.graph;

import com.gentoro.codex.exception.StateException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle transition table.
 *
 * <pre>
 *   from \ to   ICE   WATER  GAS
 *   (new)       yes   yes    yes
 *   ICE         yes   no     yes
 *   WATER       yes   yes    yes
 *   GAS         no    no     yes
 * </pre>
 */
public final class StateTransitions {
  private static final Map<ContentState, Set<ContentState>> ALLOWED =
      new EnumMap<>(ContentState.class);

  static {
    ALLOWED.put(ContentState.ICE, EnumSet.of(ContentState.ICE, ContentState.GAS));
    ALLOWED.put(ContentState.WATER, EnumSet.allOf(ContentState.class));
    ALLOWED.put(ContentState.GAS, EnumSet.of(ContentState.GAS));
  }

  private StateTransitions() {}

  /**
   * @param from current state, or {@code null} when the node does not exist yet
   */
  public static boolean isAllowed(ContentState from, ContentState to) {
    if (to == null) return false;
    if (from == null) return true;
    return ALLOWED.get(from).contains(to);
  }

  public static void check(String nodeId, ContentState from, ContentState to) {
    if (!isAllowed(from, to)) {
      throw new StateException(
          "Transition %s -> %s is not allowed for node '%s'".formatted(from, to, nodeId),
          Map.of("nodeId", nodeId, "from", String.valueOf(from), "to", String.valueOf(to)));
    }
  }
}
