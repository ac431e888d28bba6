package com.gentoro.codex.exception;

/** Resource requested was not found. */
public class NotFoundException extends CodexException {
  public NotFoundException(String message) {
    super(CodexErrorCode.NOT_FOUND, message);
  }
}
