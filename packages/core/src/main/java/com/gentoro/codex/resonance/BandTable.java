package com.gentoro.codex.resonance;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.commons.configuration2.Configuration;

/** Band name to attractor lookup, iterated in band-name order. */
public final class BandTable {
  public static final String LOW = "low";
  public static final String MID = "mid";
  public static final String HIGH = "high";

  private final Map<String, BandAttractor> attractors;

  public BandTable(Collection<BandAttractor> attractors) {
    Map<String, BandAttractor> m = new TreeMap<>();
    for (BandAttractor a : attractors) {
      m.put(a.band(), a);
    }
    if (m.isEmpty()) {
      throw new IllegalArgumentException("band table needs at least one attractor");
    }
    this.attractors = Collections.unmodifiableMap(m);
  }

  public static BandTable defaults() {
    return new BandTable(
        List.of(
            new BandAttractor(LOW, 432.0, "grounding"),
            new BandAttractor(MID, 528.0, "connective"),
            new BandAttractor(HIGH, 741.0, "cognitive")));
  }

  /**
   * Defaults overridden by {@code resonance.bands.<name>: <frequency>}; unknown names add a band.
   */
  public static BandTable fromConfiguration(Configuration config) {
    Map<String, BandAttractor> m = new TreeMap<>();
    for (BandAttractor a : defaults().all()) {
      m.put(a.band(), a);
    }
    Configuration bands = config.subset("resonance.bands");
    Iterator<String> keys = bands.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      double f = bands.getDouble(name);
      BandAttractor prev = m.get(name);
      m.put(name, new BandAttractor(name, f, prev == null ? name : prev.cluster()));
    }
    return new BandTable(m.values());
  }

  public Collection<BandAttractor> all() {
    return attractors.values();
  }

  public Optional<BandAttractor> get(String band) {
    return Optional.ofNullable(attractors.get(band));
  }

  /** Attractor closest to {@code frequency}; ties go to the first band name. */
  public BandAttractor nearest(double frequency) {
    BandAttractor best = null;
    double bestDist = Double.POSITIVE_INFINITY;
    for (BandAttractor a : attractors.values()) {
      double d = Math.abs(frequency - a.frequency());
      if (d < bestDist) {
        best = a;
        bestDist = d;
      }
    }
    return best;
  }

  public double minFrequency() {
    return attractors.values().stream().mapToDouble(BandAttractor::frequency).min().orElse(0);
  }

  public double maxFrequency() {
    return attractors.values().stream().mapToDouble(BandAttractor::frequency).max().orElse(0);
  }
}
