package com.gentoro.codex.exception;

import java.util.Map;

/** Malformed node, edge or input; rejected before anything is written. */
public class ValidationException extends CodexException {
  public ValidationException(String message) {
    super(CodexErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(CodexErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Throwable cause) {
    super(CodexErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
