package com.gentoro.codex.resonance;

import java.util.Comparator;
import java.util.Objects;

/**
 * One frequency component of a concept symbol.
 *
 * @param band band label the component belongs to
 * @param frequency frequency in Hz
 * @param phase phase in radians
 * @param amplitude non-negative weight
 */
public record HarmonicComponent(String band, double frequency, double phase, double amplitude)
    implements Comparable<HarmonicComponent> {

  private static final Comparator<HarmonicComponent> ORDER =
      Comparator.comparing(HarmonicComponent::band)
          .thenComparingDouble(HarmonicComponent::frequency)
          .thenComparingDouble(HarmonicComponent::phase)
          .thenComparingDouble(HarmonicComponent::amplitude);

  public HarmonicComponent {
    Objects.requireNonNull(band, "band");
    if (amplitude < 0 || Double.isNaN(amplitude)) {
      throw new IllegalArgumentException("amplitude must be >= 0, got " + amplitude);
    }
  }

  @Override
  public int compareTo(HarmonicComponent o) {
    return ORDER.compare(this, o);
  }
}
