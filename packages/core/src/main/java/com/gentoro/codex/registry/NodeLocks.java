package com.gentoro.codex.registry;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** Striped locks keyed by node id. Distinct ids only contend when they hash to the same stripe. */
final class NodeLocks {
  static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] stripes;

  NodeLocks() {
    this(DEFAULT_STRIPES);
  }

  NodeLocks(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("stripe count must be positive");
    }
    stripes = new ReentrantLock[count];
    for (int i = 0; i < count; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  ReentrantLock lockFor(String key) {
    return stripes[Math.floorMod(key.hashCode(), stripes.length)];
  }

  <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
