package com.gentoro.codex.storage.memory;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.graph.NodeExpiry;
import com.gentoro.codex.storage.AbstractNodeStore;
import com.gentoro.codex.storage.WaterStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

public class InMemoryWaterStore extends AbstractNodeStore implements WaterStore {

  public InMemoryWaterStore() {
    super(MemoryStorageBackendProvider.ID, EnumSet.of(ContentState.WATER, ContentState.GAS));
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
    return purged;
  }

  @Override
  protected void hydrate(Map<String, Node> target) {}

  @Override
  protected void persist(Node node) {}

  @Override
  protected void erase(String id) {}
}
