package com.gentoro.codex.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.exception.ConfigException;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import java.time.Instant;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;

class GasRetentionPolicyTest {

  private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

  private static Node gas(String since) {
    return Node.builder("g", "t").state(ContentState.GAS).meta(MetaSchema.GAS_SINCE, since).build();
  }

  @Test
  void retainIsTheDefault() {
    GasRetentionPolicy policy = GasRetentionPolicy.fromConfiguration(new BaseConfiguration());
    assertEquals(GasRetentionPolicy.Mode.RETAIN, policy.mode());
    assertFalse(policy.isPurgeable(gas("2000-01-01T00:00:00Z"), NOW));
  }

  @Test
  void purgeAfterPeriod() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("registry.gas.retention", "purge-after");
    cfg.setProperty("registry.gas.retentionPeriod", "P30D");
    GasRetentionPolicy policy = GasRetentionPolicy.fromConfiguration(cfg);

    assertTrue(policy.isPurgeable(gas("2026-05-01T00:00:00Z"), NOW));
    assertFalse(policy.isPurgeable(gas("2026-05-15T00:00:00Z"), NOW));
    assertFalse(policy.isPurgeable(Node.builder("g", "t").state(ContentState.GAS).build(), NOW));
  }

  @Test
  void invalidConfiguration() {
    Configuration missingPeriod = new BaseConfiguration();
    missingPeriod.setProperty("registry.gas.retention", "purge-after");
    assertThrows(ConfigException.class, () -> GasRetentionPolicy.fromConfiguration(missingPeriod));

    Configuration badPeriod = new BaseConfiguration();
    badPeriod.setProperty("registry.gas.retention", "purge-after");
    badPeriod.setProperty("registry.gas.retentionPeriod", "thirty days");
    assertThrows(ConfigException.class, () -> GasRetentionPolicy.fromConfiguration(badPeriod));

    Configuration unknown = new BaseConfiguration();
    unknown.setProperty("registry.gas.retention", "compost");
    assertThrows(ConfigException.class, () -> GasRetentionPolicy.fromConfiguration(unknown));
  }
}
