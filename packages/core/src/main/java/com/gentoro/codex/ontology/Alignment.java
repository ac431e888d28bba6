package com.gentoro.codex.ontology;

/** Result of aligning a concept to an ontology axis. */
public record Alignment(String axisId, String band, double resonance) {}
