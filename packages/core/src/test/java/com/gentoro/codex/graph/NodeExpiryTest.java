package com.gentoro.codex.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class NodeExpiryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void isoStringHint() {
    Node n = Node.builder("a", "t").meta(MetaSchema.EXPIRES_AT, "2026-03-01T11:59:59Z").build();
    assertTrue(NodeExpiry.isExpired(n, NOW));
  }

  @Test
  void epochMillisHint() {
    Node past = Node.builder("a", "t").meta(MetaSchema.EXPIRES_AT, NOW.toEpochMilli()).build();
    Node future =
        Node.builder("b", "t").meta(MetaSchema.EXPIRES_AT, NOW.toEpochMilli() + 1000).build();
    assertTrue(NodeExpiry.isExpired(past, NOW));
    assertFalse(NodeExpiry.isExpired(future, NOW));
  }

  @Test
  void missingOrGarbageMeansNoExpiry() {
    assertFalse(NodeExpiry.isExpired(Node.builder("a", "t").build(), NOW));
    assertFalse(
        NodeExpiry.isExpired(
            Node.builder("a", "t").meta(MetaSchema.EXPIRES_AT, "tomorrow").build(), NOW));
  }
}
