package com.gentoro.codex.storage.file;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.storage.AbstractNodeStore;
import com.gentoro.codex.storage.IceStore;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;

/** Durable ice tier: one JSON file per node under {@code <rootDir>/ice}. */
public class FileIceStore extends AbstractNodeStore implements IceStore {
  private final JsonFileDirectory files;

  public FileIceStore(Path dir) {
    super(FileStorageBackendProvider.ID, EnumSet.of(ContentState.ICE));
    this.files = new JsonFileDirectory(dir);
  }

  @Override
  protected void hydrate(Map<String, Node> target) {
    files.create();
    for (Node n : files.readAll(Node.class)) {
      target.put(n.id(), n);
    }
  }

  @Override
  protected void persist(Node node) {
    files.write(node.id(), node);
  }

  @Override
  protected void erase(String id) {
    files.delete(id);
  }
}
