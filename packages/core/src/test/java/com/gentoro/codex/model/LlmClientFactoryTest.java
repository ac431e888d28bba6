package com.gentoro.codex.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.exception.ConfigException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LlmClientFactoryTest {

  @Test
  @DisplayName("the active profile selects the provider through the service loader")
  void resolvesActiveProfile() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("llm.active-profile", "local");
    cfg.setProperty("llm.local.provider", "Ollama");
    cfg.setProperty("llm.local.model", "llama-test");

    assertInstanceOf(OllamaLlmClient.class, LlmClientFactory.createProvider(cfg));
  }

  @Test
  void missingProfileFails() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("llm.active-profile", "cloud");
    cfg.setProperty("llm.local.provider", "ollama");

    ConfigException e =
        assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(cfg));
    assertTrue(e.getMessage().contains("llm.cloud"));
  }

  @Test
  void unknownOrMissingProviderFails() {
    BaseConfiguration unknown = new BaseConfiguration();
    unknown.setProperty("provider", "gpt-nine");
    assertThrows(ConfigException.class, () -> LlmClientFactory.create(unknown));

    assertThrows(ConfigException.class, () -> LlmClientFactory.create(new BaseConfiguration()));
  }
}
