package com.gentoro.codex.graph;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Reads the water-tier expiry hint from node meta. Unparseable hints mean "no expiry". */
public final class NodeExpiry {
  private NodeExpiry() {}

  public static Optional<Instant> expiresAt(Node node) {
    return readInstant(node.metaValue(MetaSchema.EXPIRES_AT));
  }

  public static boolean isExpired(Node node, Instant now) {
    return expiresAt(node).map(t -> !t.isAfter(now)).orElse(false);
  }

  public static Optional<Instant> readInstant(Object raw) {
    if (raw == null) return Optional.empty();
    if (raw instanceof Number n) {
      return Optional.of(Instant.ofEpochMilli(n.longValue()));
    }
    if (raw instanceof Instant i) {
      return Optional.of(i);
    }
    String s = raw.toString().trim();
    if (s.isEmpty()) return Optional.empty();
    try {
      return Optional.of(Instant.parse(s));
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(Instant.ofEpochMilli(Long.parseLong(s)));
      } catch (NumberFormatException ignored) {
        return Optional.empty();
      }
    }
  }
}
