package com.gentoro.codex.ingestion;

import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * {@link SourceRegistry} backed by configuration:
 *
 * <pre>
 *   sources:
 *     reuters:
 *       name: Reuters World News
 * </pre>
 */
public class ConfiguredSourceRegistry implements SourceRegistry {
  private final Configuration configuration;

  public ConfiguredSourceRegistry(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public Optional<String> resolveName(String sourceId) {
    if (sourceId == null || sourceId.isBlank()) return Optional.empty();
    String name = configuration.getString("sources.%s.name".formatted(sourceId), null);
    return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
  }
}
