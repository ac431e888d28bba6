package com.gentoro.codex.resonance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A multiset of harmonic components plus an optional mixing weight {@code mu}. Components are
 * stored sorted, so two symbols built from the same components in any order are equal.
 */
public record ConceptSymbol(List<HarmonicComponent> components, Double mu)
    implements Comparable<ConceptSymbol> {

  public static final ConceptSymbol EMPTY = new ConceptSymbol(List.of(), null);

  public ConceptSymbol {
    List<HarmonicComponent> sorted = new ArrayList<>(components == null ? List.of() : components);
    sorted.forEach(c -> Objects.requireNonNull(c, "component"));
    Collections.sort(sorted);
    components = List.copyOf(sorted);
  }

  public static ConceptSymbol of(HarmonicComponent... components) {
    return new ConceptSymbol(List.of(components), null);
  }

  public boolean isEmpty() {
    return components.isEmpty();
  }

  @Override
  public int compareTo(ConceptSymbol o) {
    int n = Math.min(components.size(), o.components.size());
    for (int i = 0; i < n; i++) {
      int c = components.get(i).compareTo(o.components.get(i));
      if (c != 0) return c;
    }
    int c = Integer.compare(components.size(), o.components.size());
    if (c != 0) return c;
    if (mu == null) return o.mu == null ? 0 : -1;
    if (o.mu == null) return 1;
    return Double.compare(mu, o.mu);
  }
}
