package com.gentoro.codex.exception;

import java.util.Map;

/**
 * A persistence backend could not complete a call. Surfaced to the caller unchanged; the registry
 * never retries on its own.
 */
public class StorageUnavailableException extends CodexException {
  public StorageUnavailableException(String message) {
    super(CodexErrorCode.STORAGE_UNAVAILABLE, message);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(CodexErrorCode.STORAGE_UNAVAILABLE, message, cause);
  }

  public StorageUnavailableException(String message, Map<String, ?> context, Throwable cause) {
    super(CodexErrorCode.STORAGE_UNAVAILABLE, message, context, cause);
  }
}
