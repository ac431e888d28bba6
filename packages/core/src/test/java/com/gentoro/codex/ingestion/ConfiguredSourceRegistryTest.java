package com.gentoro.codex.ingestion;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class ConfiguredSourceRegistryTest {

  @Test
  void resolvesConfiguredNames() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("sources.reuters.name", "Reuters World");
    cfg.setProperty("sources.blank.name", " ");
    ConfiguredSourceRegistry sources = new ConfiguredSourceRegistry(cfg);

    assertEquals(Optional.of("Reuters World"), sources.resolveName("reuters"));
    assertEquals(Optional.empty(), sources.resolveName("blank"));
    assertEquals(Optional.empty(), sources.resolveName("bbc"));
    assertEquals(Optional.empty(), sources.resolveName(null));
  }
}
