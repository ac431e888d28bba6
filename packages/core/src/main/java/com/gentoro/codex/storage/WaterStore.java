package com.gentoro.codex.storage;

import com.gentoro.codex.graph.Node;
import java.time.Instant;
import java.util.List;

/**
 * Working tier. Holds WATER and GAS nodes. WATER nodes whose {@code expiresAt} hint has passed
 * stay readable until {@link #purgeExpired(Instant)} removes them. GAS nodes never expire here;
 * their removal is left to the registry's retention policy.
 */
public interface WaterStore extends NodeStore {

  List<Node> listExpired(Instant now);

  /** Removes expired nodes and returns their ids. */
  List<String> purgeExpired(Instant now);
}
