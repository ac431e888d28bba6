package com.gentoro.codex.ingestion;

/** A concept candidate returned by a {@link ConceptExtractor}; score is a confidence in [0,1]. */
public record ExtractedConcept(String name, double score) {}
