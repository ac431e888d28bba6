package com.gentoro.codex.storage.file;

import com.gentoro.codex.storage.EdgeStore;
import com.gentoro.codex.storage.IceStore;
import com.gentoro.codex.storage.StorageBackendProvider;
import com.gentoro.codex.storage.WaterStore;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/** JSON-file backend rooted at {@code storage.file.rootDir}. */
public class FileStorageBackendProvider implements StorageBackendProvider {
  public static final String ID = "file";
  public static final String DEFAULT_ROOT_DIR = "data/codex";

  @Override
  public String backendId() {
    return ID;
  }

  @Override
  public IceStore createIceStore(Configuration storageConfig) {
    return new FileIceStore(rootDir(storageConfig).resolve("ice"));
  }

  @Override
  public WaterStore createWaterStore(Configuration storageConfig) {
    return new FileWaterStore(rootDir(storageConfig).resolve("water"));
  }

  @Override
  public EdgeStore createEdgeStore(Configuration storageConfig) {
    return new FileEdgeStore(rootDir(storageConfig).resolve("edges"));
  }

  private static Path rootDir(Configuration storageConfig) {
    return Path.of(storageConfig.getString("file.rootDir", DEFAULT_ROOT_DIR));
  }
}
