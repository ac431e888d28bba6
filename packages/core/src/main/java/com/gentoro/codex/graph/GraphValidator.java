package com.gentoro.codex.graph;

import com.gentoro.codex.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Structural checks applied to every node and edge before it reaches a store. */
public final class GraphValidator {
  private GraphValidator() {}

  public static void validate(Node node) {
    if (node == null) {
      throw new ValidationException("Node must not be null");
    }
    if (isBlank(node.id())) {
      throw new ValidationException("Node id must not be blank");
    }
    if (isBlank(node.typeId())) {
      throw new ValidationException(
          "Node typeId must not be blank", Map.of("nodeId", node.id()));
    }
    if (node.state() == null) {
      throw new ValidationException("Node state must not be null", Map.of("nodeId", node.id()));
    }
    if (node.content() != null && node.content().variantCount() > 1) {
      throw new ValidationException(
          "ContentRef of node '%s' populates %d payload variants; at most one is allowed"
              .formatted(node.id(), node.content().variantCount()),
          Map.of("nodeId", node.id()));
    }
    List<String> missing = new ArrayList<>();
    for (String key : MetaSchema.requiredKeys(node.typeId())) {
      Object v = node.meta().get(key);
      if (v == null || (v instanceof String s && s.isBlank())) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      throw new ValidationException(
          "Node '%s' of type '%s' is missing required meta %s"
              .formatted(node.id(), node.typeId(), missing),
          Map.of("nodeId", node.id(), "typeId", node.typeId(), "missing", missing));
    }
  }

  public static void validate(Edge edge) {
    if (edge == null) {
      throw new ValidationException("Edge must not be null");
    }
    if (isBlank(edge.fromId()) || isBlank(edge.toId()) || isBlank(edge.role())) {
      throw new ValidationException(
          "Edge endpoints and role must not be blank: " + edge.key());
    }
    if (Double.isNaN(edge.weight()) || Double.isInfinite(edge.weight())) {
      throw new ValidationException("Edge weight must be finite: " + edge.key());
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
