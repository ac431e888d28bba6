package com.gentoro.codex.ontology;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.resonance.BandTable;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.HarmonicComponent;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConceptSymbolFactoryTest {

  private final ConceptSymbolFactory factory =
      new ConceptSymbolFactory(DefaultOntology.axes(), BandTable.defaults());

  @Test
  @DisplayName("keyword matches put a component on each matching axis")
  void keywordComponents() {
    ConceptSymbol symbol = factory.symbolFor("Global Research Collaboration", 0.8);

    assertEquals(2, symbol.components().size());
    assertTrue(symbol.components().contains(new HarmonicComponent("low", 440.0, 0.0, 0.8)));
    assertTrue(symbol.components().contains(new HarmonicComponent("mid", 520.0, 0.0, 0.8)));
  }

  @Test
  void keywordsMatchWholeWordsOnly() {
    ConceptSymbolFactory noAxes = new ConceptSymbolFactory(List.of(), BandTable.defaults());
    assertEquals(noAxes.symbolFor("renewables", 1.0), factory.symbolFor("renewables", 1.0));
  }

  @Test
  @DisplayName("unmatched names get a stable hashed frequency within the band range")
  void hashedFallback() {
    ConceptSymbol first = factory.symbolFor("Quantum", 0.9);
    ConceptSymbol second = factory.symbolFor("quantum", 0.9);

    assertEquals(first, second);
    HarmonicComponent c = first.components().get(0);
    assertTrue(c.frequency() >= 372 && c.frequency() <= 801, "frequency " + c.frequency());
    assertEquals(BandTable.defaults().nearest(c.frequency()).band(), c.band());
    assertEquals(0.9, c.amplitude());
  }

  @Test
  void nonPositiveScoreFallsBackToUnitAmplitude() {
    assertEquals(1.0, factory.symbolFor("science", 0.0).components().get(0).amplitude());
  }

  @Test
  void blankNameIsEmpty() {
    assertTrue(factory.symbolFor("  ", 1.0).isEmpty());
  }
}
