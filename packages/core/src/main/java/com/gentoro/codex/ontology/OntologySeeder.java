package com.gentoro.codex.ontology;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.registry.NodeRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Writes ontology axes into the registry as ICE nodes linked parent to child. Idempotent. */
public class OntologySeeder {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(OntologySeeder.class);

  public static final String HIERARCHY_ROLE = "leads-to";

  private final NodeRegistry registry;

  public OntologySeeder(NodeRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public int seedDefaults() {
    return seed(DefaultOntology.axes());
  }

  /**
   * @return number of axes written (retired axes are left alone)
   */
  public int seed(List<OntologyAxis> axes) {
    int written = 0;
    for (OntologyAxis axis : axes) {
      Optional<Node> existing = registry.get(axis.id());
      if (existing.isPresent() && existing.get().state() == ContentState.GAS) {
        log.warn("Ontology axis '{}' is retired; not re-seeding it", axis.id());
        continue;
      }
      registry.upsert(axis.toNode());
      written++;
    }
    for (OntologyAxis axis : axes) {
      if (axis.parentId() != null) {
        registry.upsert(new Edge(axis.parentId(), axis.id(), HIERARCHY_ROLE));
      }
    }
    log.info("Seeded {} ontology axis node(s)", written);
    return written;
  }
}
