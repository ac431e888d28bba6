package com.gentoro.codex.resonance;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.commons.configuration2.Configuration;

/**
 * Frequency-based similarity between concept symbols.
 *
 * <p>{@code resonance(A, B) = (1 - mix) * closeness + mix * bandBonus} where {@code closeness} is
 * the amplitude-weighted mean over all component pairs of {@code exp(-|fa - fb| / bandwidth) * (1
 * + cos(pa - pb)) / 2}, {@code bandBonus} is 1 when both symbols share a dominant band, and {@code
 * mix} is the mean of the two symbols' {@code mu} (the configured default where absent).
 *
 * <p>All operations are pure and never throw for well-formed symbols.
 */
public final class ResonanceEngine {
  public static final double DEFAULT_BANDWIDTH = 25.0;
  public static final double DEFAULT_MIX = 0.2;

  private final BandTable bands;
  private final double bandwidth;
  private final double defaultMix;

  public ResonanceEngine() {
    this(BandTable.defaults(), DEFAULT_BANDWIDTH, DEFAULT_MIX);
  }

  public ResonanceEngine(BandTable bands, double bandwidth, double defaultMix) {
    this.bands = Objects.requireNonNull(bands, "bands");
    if (!(bandwidth > 0)) {
      throw new IllegalArgumentException("bandwidth must be positive, got " + bandwidth);
    }
    if (defaultMix < 0 || defaultMix > 1) {
      throw new IllegalArgumentException("defaultMix must be within [0,1], got " + defaultMix);
    }
    this.bandwidth = bandwidth;
    this.defaultMix = defaultMix;
  }

  public static ResonanceEngine fromConfiguration(Configuration config) {
    return new ResonanceEngine(
        BandTable.fromConfiguration(config),
        config.getDouble("resonance.bandwidth", DEFAULT_BANDWIDTH),
        config.getDouble("resonance.defaultMix", DEFAULT_MIX));
  }

  public BandTable bands() {
    return bands;
  }

  /**
   * Attractor with the highest {@code sum(amplitude / (1 + |frequency - attractor|))}. Ties go to
   * the lexicographically smallest band name; empty or silent input has no dominant band.
   */
  public Optional<BandAttractor> dominantBand(List<HarmonicComponent> components) {
    if (components == null || components.isEmpty()) return Optional.empty();
    double totalAmplitude = 0;
    for (HarmonicComponent c : components) totalAmplitude += c.amplitude();
    if (totalAmplitude <= 0) return Optional.empty();

    BandAttractor best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (BandAttractor a : bands.all()) {
      double score = 0;
      for (HarmonicComponent c : components) {
        score += c.amplitude() / (1.0 + Math.abs(c.frequency() - a.frequency()));
      }
      if (score > bestScore) {
        best = a;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  public Optional<BandAttractor> dominantBand(ConceptSymbol symbol) {
    return symbol == null ? Optional.empty() : dominantBand(symbol.components());
  }

  /** Similarity in [0, 1]; symmetric bit-for-bit. Empty symbols resonate with nothing. */
  public double resonance(ConceptSymbol a, ConceptSymbol b) {
    if (a == null || b == null || a.isEmpty() || b.isEmpty()) return 0.0;
    if (a.compareTo(b) > 0) {
      ConceptSymbol t = a;
      a = b;
      b = t;
    }

    double weighted = 0;
    double weights = 0;
    for (HarmonicComponent ca : a.components()) {
      for (HarmonicComponent cb : b.components()) {
        double w = ca.amplitude() * cb.amplitude();
        if (w == 0) continue;
        double freq = Math.exp(-Math.abs(ca.frequency() - cb.frequency()) / bandwidth);
        double phase = (1.0 + Math.cos(ca.phase() - cb.phase())) / 2.0;
        weighted += w * freq * phase;
        weights += w;
      }
    }
    double closeness = weights > 0 ? weighted / weights : 0.0;

    Optional<BandAttractor> da = dominantBand(a);
    Optional<BandAttractor> db = dominantBand(b);
    double bandBonus =
        da.isPresent() && db.isPresent() && da.get().band().equals(db.get().band()) ? 1.0 : 0.0;

    double mix = (muOf(a) + muOf(b)) / 2.0;
    // the bonus only lifts pairs that are already close
    double r = (1.0 - mix) * closeness + mix * bandBonus * closeness;
    if (Double.isNaN(r)) return 0.0;
    return Math.max(0.0, Math.min(1.0, r));
  }

  /** {@code (1 - r) + sqrt(1 - r^2)}: 0 for identical resonance, 2 for none. */
  public double distance(ConceptSymbol a, ConceptSymbol b) {
    double r = resonance(a, b);
    return (1.0 - r) + Math.sqrt(Math.max(0.0, 1.0 - r * r));
  }

  /** Highest-resonance candidate; ties go to the smallest key. */
  public Optional<Match> bestMatch(ConceptSymbol symbol, Map<String, ConceptSymbol> candidates) {
    if (candidates == null || candidates.isEmpty()) return Optional.empty();
    Match best = null;
    for (Map.Entry<String, ConceptSymbol> e : new TreeMap<>(candidates).entrySet()) {
      double r = resonance(symbol, e.getValue());
      if (best == null || r > best.resonance()) {
        best = new Match(e.getKey(), r);
      }
    }
    return Optional.of(best);
  }

  private double muOf(ConceptSymbol s) {
    Double mu = s.mu();
    if (mu == null || Double.isNaN(mu)) return defaultMix;
    return Math.max(0.0, Math.min(1.0, mu));
  }

  public record Match(String key, double resonance) {}
}
