package com.gentoro.codex.exception;

import java.util.Map;

/**
 * Structured view of a failure, as recorded on an item's {@code pipelineErrors} or logged by the
 * ingestion runner.
 */
public record ErrorDetails(
    String type, CodexErrorCode code, String message, Map<String, Object> context) {

  public ErrorDetails {
    message = message == null ? "" : message;
    context = context == null ? Map.of() : context;
  }

  /** {@code Type[CODE]: message}, the form stored in node metadata. */
  public String oneLine() {
    return type + "[" + code + "]: " + message;
  }
}
