package com.gentoro.codex.ontology;

import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.registry.NodeRegistry;
import com.gentoro.codex.resonance.BandAttractor;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.ResonanceEngine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Chooses the ontology axis a concept belongs to: the dominant band of the concept's symbol
 * narrows the candidates, then the best-resonating axis among them wins (ties to the smallest
 * axis id). When no axis sits in the dominant band every axis is a candidate.
 */
public class OntologyAligner {
  private final ResonanceEngine engine;
  private final Supplier<List<OntologyAxis>> axes;

  public OntologyAligner(ResonanceEngine engine, Supplier<List<OntologyAxis>> axes) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.axes = Objects.requireNonNull(axes, "axes");
  }

  /** Aligner reading the live axes from the registry on every call. */
  public static OntologyAligner fromRegistry(ResonanceEngine engine, NodeRegistry registry) {
    return new OntologyAligner(
        engine,
        () ->
            registry.getNodesByType(MetaSchema.ONTOLOGY_AXIS).stream()
                .map(OntologyAxis::fromNode)
                .toList());
  }

  public List<OntologyAxis> axes() {
    return axes.get();
  }

  public Optional<Alignment> align(ConceptSymbol symbol) {
    if (symbol == null || symbol.isEmpty()) return Optional.empty();
    List<OntologyAxis> all = axes.get();
    if (all.isEmpty()) return Optional.empty();

    Optional<BandAttractor> band = engine.dominantBand(symbol);
    Map<String, ConceptSymbol> candidates = new LinkedHashMap<>();
    Map<String, OntologyAxis> byId = new LinkedHashMap<>();
    for (OntologyAxis axis : all) {
      byId.put(axis.id(), axis);
      if (band.isPresent() && band.get().band().equals(axis.band())) {
        candidates.put(axis.id(), axis.symbol());
      }
    }
    if (candidates.isEmpty()) {
      all.forEach(a -> candidates.put(a.id(), a.symbol()));
    }
    return engine
        .bestMatch(symbol, candidates)
        .map(m -> new Alignment(m.key(), byId.get(m.key()).band(), m.resonance()));
  }
}
