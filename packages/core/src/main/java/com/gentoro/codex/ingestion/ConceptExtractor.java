package com.gentoro.codex.ingestion;

import java.util.List;

/** Text in, concept candidates out. Implementations usually call a remote model. */
@FunctionalInterface
public interface ConceptExtractor {

  /**
   * @throws com.gentoro.codex.exception.ExternalServiceException when the collaborator fails
   */
  List<ExtractedConcept> extractConcepts(String text);
}
