package com.gentoro.codex.storage;

import com.gentoro.codex.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates tier stores from configuration.
 *
 * <pre>
 *   storage:
 *     ice:   { backend: file }
 *     water: { backend: memory }
 *     edges: { backend: file }
 *     file:  { rootDir: data/codex }
 * </pre>
 */
public final class StorageBackendFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(StorageBackendFactory.class);

  public static final String DEFAULT_BACKEND = "memory";

  private StorageBackendFactory() {}

  public static IceStore createIceStore(Configuration config) {
    StorageBackendProvider p = resolve(config, "ice");
    return p.createIceStore(config.subset("storage"));
  }

  public static WaterStore createWaterStore(Configuration config) {
    StorageBackendProvider p = resolve(config, "water");
    return p.createWaterStore(config.subset("storage"));
  }

  public static EdgeStore createEdgeStore(Configuration config) {
    StorageBackendProvider p = resolve(config, "edges");
    return p.createEdgeStore(config.subset("storage"));
  }

  static StorageBackendProvider resolve(Configuration config, String tier) {
    String key = "storage.%s.backend".formatted(tier);
    String backend = config.getString(key, DEFAULT_BACKEND).trim().toLowerCase(Locale.ROOT);
    for (StorageBackendProvider p : ServiceLoader.load(StorageBackendProvider.class)) {
      if (backend.equals(p.backendId())) {
        log.debug("Using '{}' backend for {} tier", backend, tier);
        return p;
      }
    }
    throw new ConfigException("Unknown %s: %s".formatted(key, backend));
  }
}
