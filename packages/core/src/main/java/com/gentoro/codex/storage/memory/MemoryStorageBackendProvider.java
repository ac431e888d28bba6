package com.gentoro.codex.storage.memory;

import com.gentoro.codex.storage.EdgeStore;
import com.gentoro.codex.storage.IceStore;
import com.gentoro.codex.storage.StorageBackendProvider;
import com.gentoro.codex.storage.WaterStore;
import org.apache.commons.configuration2.Configuration;

public class MemoryStorageBackendProvider implements StorageBackendProvider {
  public static final String ID = "memory";

  @Override
  public String backendId() {
    return ID;
  }

  @Override
  public IceStore createIceStore(Configuration storageConfig) {
    return new InMemoryIceStore();
  }

  @Override
  public WaterStore createWaterStore(Configuration storageConfig) {
    return new InMemoryWaterStore();
  }

  @Override
  public EdgeStore createEdgeStore(Configuration storageConfig) {
    return new InMemoryEdgeStore();
  }
}
