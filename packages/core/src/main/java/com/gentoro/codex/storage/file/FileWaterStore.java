package com.gentoro.codex.storage.file;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.graph.NodeExpiry;
import com.gentoro.codex.storage.AbstractNodeStore;
import com.gentoro.codex.storage.WaterStore;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/** Water tier persisted under {@code <rootDir>/water}, so working state survives restarts. */
public class FileWaterStore extends AbstractNodeStore implements WaterStore {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(FileWaterStore.class);

  private final JsonFileDirectory files;

  public FileWaterStore(Path dir) {
    super(FileStorageBackendProvider.ID, EnumSet.of(ContentState.WATER, ContentState.GAS));
    this.files = new JsonFileDirectory(dir);
  }

  @Override
  public List<Node> listExpired(Instant now) {
    ensureOpen();
    return nodes.values().stream()
        .filter(n -> n.state() == ContentState.WATER && NodeExpiry.isExpired(n, now))
        .sorted(Comparator.comparing(Node::id))
        .toList();
  }

  @Override
  public List<String> purgeExpired(Instant now) {
    List<String> purged = new ArrayList<>();
    for (Node n : listExpired(now)) {
      if (delete(n.id())) {
        purged.add(n.id());
      }
    }
    if (!purged.isEmpty()) {
      log.debug("Purged {} expired water node(s) from {}", purged.size(), files.dir());
    }
    return purged;
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
