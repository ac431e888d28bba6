package com.gentoro.codex.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends CodexException {
  public SerializationException(String message, Throwable cause) {
    super(CodexErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
