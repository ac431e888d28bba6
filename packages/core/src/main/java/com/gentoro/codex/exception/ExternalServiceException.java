package com.gentoro.codex.exception;

/** A remote collaborator (LLM, extraction service) failed, timed out or answered garbage. */
public class ExternalServiceException extends CodexException {
  public ExternalServiceException(String message) {
    super(CodexErrorCode.EXTERNAL_SERVICE_ERROR, message);
  }

  public ExternalServiceException(String message, Throwable cause) {
    super(CodexErrorCode.EXTERNAL_SERVICE_ERROR, message, cause);
  }
}
