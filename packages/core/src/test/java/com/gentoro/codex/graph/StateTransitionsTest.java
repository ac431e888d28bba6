package com.gentoro.codex.graph;

import static com.gentoro.codex.graph.ContentState.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.exception.CodexErrorCode;
import com.gentoro.codex.exception.StateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StateTransitionsTest {

  @Test
  @DisplayName("new nodes may start in any state")
  void newNodes() {
    for (ContentState s : ContentState.values()) {
      assertTrue(StateTransitions.isAllowed(null, s));
    }
  }

  @Test
  void transitionTable() {
    assertTrue(StateTransitions.isAllowed(ICE, ICE));
    assertFalse(StateTransitions.isAllowed(ICE, WATER));
    assertTrue(StateTransitions.isAllowed(ICE, GAS));

    assertTrue(StateTransitions.isAllowed(WATER, ICE));
    assertTrue(StateTransitions.isAllowed(WATER, WATER));
    assertTrue(StateTransitions.isAllowed(WATER, GAS));

    assertFalse(StateTransitions.isAllowed(GAS, ICE));
    assertFalse(StateTransitions.isAllowed(GAS, WATER));
    assertTrue(StateTransitions.isAllowed(GAS, GAS));
  }

  @Test
  void checkThrowsWithContext() {
    StateException ex =
        assertThrows(StateException.class, () -> StateTransitions.check("n", ICE, WATER));
    assertEquals(CodexErrorCode.FAILED_PRECONDITION, ex.getCode());
    assertEquals("n", ex.getContext().get("nodeId"));
    assertEquals("ICE", ex.getContext().get("from"));
  }
}
