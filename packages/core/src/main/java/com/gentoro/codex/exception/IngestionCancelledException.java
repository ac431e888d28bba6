package com.gentoro.codex.exception;

import java.util.Map;

/** An ingestion run was cancelled between stages. Work already written stays valid. */
public class IngestionCancelledException extends CodexException {
  public IngestionCancelledException(String itemId, String nextStage) {
    super(
        CodexErrorCode.CANCELLED,
        "Ingestion of '%s' cancelled before stage %s".formatted(itemId, nextStage),
        Map.of("itemId", itemId, "stage", nextStage));
  }
}
