package com.gentoro.codex.storage.memory;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.storage.AbstractNodeStore;
import com.gentoro.codex.storage.IceStore;
import java.util.EnumSet;
import java.util.Map;

/** Volatile ice tier, for tests and throwaway runs. */
public class InMemoryIceStore extends AbstractNodeStore implements IceStore {

  public InMemoryIceStore() {
    super(MemoryStorageBackendProvider.ID, EnumSet.of(ContentState.ICE));
  }

  @Override
  protected void hydrate(Map<String, Node> target) {}

  @Override
  protected void persist(Node node) {}

  @Override
  protected void erase(String id) {}
}
