package com.gentoro.codex.ingestion;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run.
 *
 * @param alignments concept id to chosen ontology axis id
 * @param errors stage name to error description, empty when every stage succeeded
 */
public record IngestionResult(
    String itemId,
    String contentId,
    String summaryId,
    List<String> conceptIds,
    Map<String, String> alignments,
    Map<String, String> errors,
    Status status) {

  public enum Status {
    COMPLETED,
    PARTIAL
  }

  public IngestionResult {
    conceptIds = List.copyOf(conceptIds);
    alignments = Map.copyOf(alignments);
    errors = Map.copyOf(errors);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }
}
