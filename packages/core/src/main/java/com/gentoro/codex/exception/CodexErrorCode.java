package com.gentoro.codex.exception;

/**
 * Canonical error codes for the codex graph. Codes are stable and suitable for logs and callers
 * that need to branch on the failure origin. Prefer the most specific code.
 */
public enum CodexErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  STORAGE_UNAVAILABLE,

  // Collaborators
  EXTERNAL_SERVICE_ERROR,
}
