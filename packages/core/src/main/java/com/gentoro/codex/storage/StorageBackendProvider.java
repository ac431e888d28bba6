package com.gentoro.codex.storage;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable storage backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register one by listing
 * its class in {@code META-INF/services/com.gentoro.codex.storage.StorageBackendProvider}. The
 * factory matches {@code storage.ice.backend}, {@code storage.water.backend} and {@code
 * storage.edges.backend} against {@link #backendId()}.
 */
public interface StorageBackendProvider {

  /** Stable lowercase identifier, e.g. "memory" or "file". */
  String backendId();

  /**
   * @param storageConfig the {@code storage.*} subset of the application configuration
   */
  IceStore createIceStore(Configuration storageConfig);

  WaterStore createWaterStore(Configuration storageConfig);

  EdgeStore createEdgeStore(Configuration storageConfig);
}
