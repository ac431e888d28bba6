package com.gentoro.codex.ontology;

import com.gentoro.codex.resonance.BandAttractor;
import com.gentoro.codex.resonance.BandTable;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.HarmonicComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds a deterministic {@link ConceptSymbol} for a concept name.
 *
 * <p>Every axis with a keyword appearing as a whole word in the name contributes one component at
 * the axis frequency. Names matching no keyword get a single component whose frequency is derived
 * from {@link String#hashCode()} of the lower-cased name and spread over the band range widened
 * by {@link #SPREAD_MARGIN} Hz on each side.
 */
public class ConceptSymbolFactory {
  static final double SPREAD_MARGIN = 60.0;

  private final List<OntologyAxis> axes;
  private final BandTable bands;

  public ConceptSymbolFactory(List<OntologyAxis> axes, BandTable bands) {
    this.axes = List.copyOf(axes);
    this.bands = Objects.requireNonNull(bands, "bands");
  }

  public ConceptSymbol symbolFor(String conceptName, double score) {
    String name = conceptName == null ? "" : conceptName.trim().toLowerCase(Locale.ROOT);
    if (name.isEmpty()) {
      return ConceptSymbol.EMPTY;
    }
    double amplitude = score > 0 && Double.isFinite(score) ? score : 1.0;

    List<HarmonicComponent> components = new ArrayList<>();
    for (OntologyAxis axis : axes) {
      for (String keyword : axis.keywords()) {
        if (containsWord(name, keyword)) {
          components.add(new HarmonicComponent(axis.band(), axis.frequency(), 0.0, amplitude));
          break;
        }
      }
    }
    if (components.isEmpty()) {
      double min = bands.minFrequency() - SPREAD_MARGIN;
      double max = bands.maxFrequency() + SPREAD_MARGIN;
      int span = (int) Math.round(max - min);
      double frequency = min + Math.floorMod(name.hashCode(), span + 1);
      BandAttractor band = bands.nearest(frequency);
      components.add(new HarmonicComponent(band.band(), frequency, 0.0, amplitude));
    }
    return new ConceptSymbol(components, null);
  }

  private static boolean containsWord(String name, String keyword) {
    String k = keyword.toLowerCase(Locale.ROOT);
    return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(k) + "(?![\\p{L}\\p{N}])")
        .matcher(name)
        .find();
  }
}
