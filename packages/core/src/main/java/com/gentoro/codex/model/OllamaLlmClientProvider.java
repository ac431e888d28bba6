package com.gentoro.codex.model;

import org.apache.commons.configuration2.Configuration;

/** SPI provider for Ollama-based {@link LlmClient} implementations. */
public final class OllamaLlmClientProvider implements LlmClientProvider {
  @Override
  public String providerId() {
    return "ollama";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    return new OllamaLlmClient(subConfiguration);
  }
}
