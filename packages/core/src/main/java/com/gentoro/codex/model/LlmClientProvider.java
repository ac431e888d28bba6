package com.gentoro.codex.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and identify themselves
 * with a stable {@code providerId} (e.g. "ollama"). To register a provider, add its fully
 * qualified class name to {@code META-INF/services/com.gentoro.codex.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider. */
  String providerId();

  /**
   * Creates a configured {@link LlmClient}.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.local.*}).
   * @throws com.gentoro.codex.exception.ConfigException when the configuration is invalid.
   */
  LlmClient create(Configuration subConfiguration);
}
