package com.gentoro.codex.ontology;

import com.gentoro.codex.resonance.BandTable;
import java.util.List;

/**
 * The built-in U-Core axes: one root per band and keyword axes beneath them.
 *
 * <pre>
 *   grounding (low, 432)    science, abundance
 *   connection (mid, 528)   unity, resonance
 *   awareness (high, 741)   innovation
 * </pre>
 */
public final class DefaultOntology {
  public static final String GROUNDING = OntologyAxis.idFor("grounding");
  public static final String CONNECTION = OntologyAxis.idFor("connection");
  public static final String AWARENESS = OntologyAxis.idFor("awareness");

  private DefaultOntology() {}

  public static List<OntologyAxis> axes() {
    return List.of(
        new OntologyAxis(
            GROUNDING,
            "grounding",
            BandTable.LOW,
            432.0,
            List.of("grounded", "healing", "restoration", "foundation"),
            null),
        new OntologyAxis(
            CONNECTION,
            "connection",
            BandTable.MID,
            528.0,
            List.of("love", "compassion", "heart", "connection"),
            null),
        new OntologyAxis(
            AWARENESS,
            "awareness",
            BandTable.HIGH,
            741.0,
            List.of("consciousness", "awareness", "intuition", "insight"),
            null),
        new OntologyAxis(
            OntologyAxis.idFor("science"),
            "science",
            BandTable.LOW,
            440.0,
            List.of("science", "research", "study", "experiment", "data"),
            GROUNDING),
        new OntologyAxis(
            OntologyAxis.idFor("abundance"),
            "abundance",
            BandTable.LOW,
            424.0,
            List.of("abundance", "amplification", "growth", "prosperity", "opportunity"),
            GROUNDING),
        new OntologyAxis(
            OntologyAxis.idFor("unity"),
            "unity",
            BandTable.MID,
            520.0,
            List.of("unity", "collaboration", "collective", "community", "global"),
            CONNECTION),
        new OntologyAxis(
            OntologyAxis.idFor("resonance"),
            "resonance",
            BandTable.MID,
            536.0,
            List.of("resonance", "harmony", "coherence", "joy", "peace", "wisdom"),
            CONNECTION),
        new OntologyAxis(
            OntologyAxis.idFor("innovation"),
            "innovation",
            BandTable.HIGH,
            752.0,
            List.of("innovation", "breakthrough", "cutting-edge", "new", "discovery"),
            AWARENESS));
  }
}
