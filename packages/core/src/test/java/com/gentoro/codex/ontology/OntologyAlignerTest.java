package com.gentoro.codex.ontology;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.registry.TieredNodeRegistry;
import com.gentoro.codex.resonance.BandTable;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.HarmonicComponent;
import com.gentoro.codex.resonance.ResonanceEngine;
import com.gentoro.codex.storage.memory.InMemoryEdgeStore;
import com.gentoro.codex.storage.memory.InMemoryIceStore;
import com.gentoro.codex.storage.memory.InMemoryWaterStore;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OntologyAlignerTest {

  private final ResonanceEngine engine = new ResonanceEngine();
  private final OntologyAligner aligner = new OntologyAligner(engine, DefaultOntology::axes);
  private final ConceptSymbolFactory symbols =
      new ConceptSymbolFactory(DefaultOntology.axes(), BandTable.defaults());

  @Test
  @DisplayName("a keyword concept aligns to its own axis")
  void keywordConceptAlignsToAxis() {
    Alignment a = aligner.align(symbols.symbolFor("scientific data", 0.9)).orElseThrow();
    assertEquals("u-core-axis-science", a.axisId());
    assertEquals("low", a.band());
    assertTrue(a.resonance() > 0.9);

    assertEquals(
        "u-core-axis-innovation",
        aligner.align(symbols.symbolFor("breakthrough", 0.7)).orElseThrow().axisId());
  }

  @Test
  void candidatesAreNarrowedToTheDominantBand() {
    ConceptSymbol nearMid = ConceptSymbol.of(new HarmonicComponent("x", 560, 0, 1));
    Alignment a = aligner.align(nearMid).orElseThrow();
    assertEquals("mid", a.band());
    assertEquals("u-core-axis-resonance", a.axisId());
  }

  @Test
  @DisplayName("without axes in the dominant band every axis is a candidate")
  void fallsBackToAllAxes() {
    OntologyAligner lowOnly =
        new OntologyAligner(
            engine,
            () ->
                DefaultOntology.axes().stream().filter(x -> x.band().equals("low")).toList());
    Alignment a =
        lowOnly.align(ConceptSymbol.of(new HarmonicComponent("x", 741, 0, 1))).orElseThrow();
    assertEquals("low", a.band());
  }

  @Test
  void noAxesOrEmptySymbolGivesNothing() {
    assertTrue(new OntologyAligner(engine, List::of).align(symbols.symbolFor("x", 1)).isEmpty());
    assertTrue(aligner.align(ConceptSymbol.EMPTY).isEmpty());
  }

  @Test
  void readsAxesFromTheRegistry() {
    TieredNodeRegistry registry =
        new TieredNodeRegistry(
            new InMemoryIceStore(), new InMemoryWaterStore(), new InMemoryEdgeStore());
    registry.initialize();
    OntologyAligner live = OntologyAligner.fromRegistry(engine, registry);
    assertTrue(live.align(symbols.symbolFor("unity", 1)).isEmpty());

    new OntologySeeder(registry).seedDefaults();
    assertEquals(
        "u-core-axis-unity", live.align(symbols.symbolFor("unity", 1)).orElseThrow().axisId());
  }
}
