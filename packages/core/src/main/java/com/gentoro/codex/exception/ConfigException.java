package com.gentoro.codex.exception;

/** Configuration is missing or invalid. */
public class ConfigException extends CodexException {
  public ConfigException(String message) {
    super(CodexErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(CodexErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
