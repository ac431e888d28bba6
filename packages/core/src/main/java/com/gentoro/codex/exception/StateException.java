package com.gentoro.codex.exception;

import java.util.Map;

/** Illegal lifecycle transition or otherwise unexpected state. */
public class StateException extends CodexException {
  public StateException(String message) {
    super(CodexErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Map<String, ?> context) {
    super(CodexErrorCode.FAILED_PRECONDITION, message, context);
  }
}
