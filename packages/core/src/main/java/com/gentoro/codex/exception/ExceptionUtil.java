package com.gentoro.codex.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Structured details of {@code t}. Executor wrappers ({@link ExecutionException}, {@link
   * CompletionException}) are unwrapped first; a {@link CodexException} keeps its code and
   * context, anything else is reported as {@link CodexErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof CodexException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(), ex.getCode(), ex.getMessage(), ex.getContext());
    }
    return new ErrorDetails(
        root.getClass().getSimpleName(), CodexErrorCode.UNKNOWN, root.getMessage(), null);
  }

  /** e.g. {@code "ExternalServiceException[EXTERNAL_SERVICE_ERROR]: timed out"}. */
  public static String describe(Throwable t) {
    return toErrorDetails(t).oneLine();
  }

  static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
