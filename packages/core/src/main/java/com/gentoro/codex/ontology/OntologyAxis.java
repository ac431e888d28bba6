package com.gentoro.codex.ontology;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.HarmonicComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * A fixed reference dimension concepts are aligned to.
 *
 * @param parentId id of the parent axis, {@code null} for band roots
 */
public record OntologyAxis(
    String id, String name, String band, double frequency, List<String> keywords, String parentId) {

  public static final String ID_PREFIX = "u-core-axis-";

  public OntologyAxis {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  public static String idFor(String name) {
    return ID_PREFIX + name.toLowerCase(Locale.ROOT);
  }

  /** The axis as a single-component symbol, used as a resonance target. */
  public ConceptSymbol symbol() {
    return ConceptSymbol.of(new HarmonicComponent(band, frequency, 0.0, 1.0));
  }

  public Node toNode() {
    return Node.builder(id, MetaSchema.ONTOLOGY_AXIS)
        .state(ContentState.ICE)
        .title(name)
        .description("U-Core ontology axis '%s' (%s band)".formatted(name, band))
        .meta("name", name)
        .meta("band", band)
        .meta("frequency", frequency)
        .meta("keywords", keywords)
        .meta("parentId", parentId)
        .meta("createdFrom", "ontology-seed")
        .build();
  }

  public static OntologyAxis fromNode(Node node) {
    Object rawKeywords = node.metaValue("keywords");
    List<String> keywords = new ArrayList<>();
    if (rawKeywords instanceof Collection<?> c) {
      c.forEach(k -> keywords.add(String.valueOf(k)));
    }
    Object f = node.metaValue("frequency");
    double frequency = f instanceof Number n ? n.doubleValue() : Double.parseDouble(f.toString());
    return new OntologyAxis(
        node.id(),
        node.metaString("name"),
        node.metaString("band"),
        frequency,
        keywords,
        node.metaString("parentId"));
  }
}
