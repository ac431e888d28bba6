package com.gentoro.codex.model;

import com.gentoro.codex.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates {@link LlmClient} instances from configuration via the {@link LlmClientProvider} SPI. */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /**
   * Creates a client using an indirection key under the {@code llm.*} namespace.
   *
   * <pre>
   *   llm.active-profile = local
   *   llm.local.provider = ollama
   *   llm.local.model = llama3.1
   * </pre>
   */
  public static LlmClient createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm.%s".formatted(namespace)));
  }

  /** Creates a client from a provider-specific subset configuration. */
  public static LlmClient create(Configuration subConfig) {
    String provider = subConfig.getString("provider", null);
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (id.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + id);
  }
}
