package com.gentoro.codex.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.storage.memory.InMemoryEdgeStore;
import com.gentoro.codex.storage.memory.InMemoryIceStore;
import com.gentoro.codex.storage.memory.InMemoryWaterStore;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TieredNodeRegistryConcurrencyTest {

  private InMemoryIceStore ice;
  private InMemoryWaterStore water;
  private TieredNodeRegistry registry;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    ice = new InMemoryIceStore();
    water = new InMemoryWaterStore();
    registry = new TieredNodeRegistry(ice, water, new InMemoryEdgeStore());
    registry.initialize();
    pool = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  @DisplayName("readers never see a promoted node missing or duplicated")
  void readersSeeExactlyOneCopy() throws Exception {
    int count = 200;
    for (int i = 0; i < count; i++) {
      registry.upsert(Node.builder("n" + i, "t").state(ContentState.WATER).build());
    }
    AtomicBoolean done = new AtomicBoolean();
    AtomicInteger misses = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);

    List<Future<?>> readers = new ArrayList<>();
    for (int r = 0; r < 3; r++) {
      readers.add(
          pool.submit(
              () -> {
                start.await();
                while (!done.get()) {
                  for (int i = 0; i < count; i++) {
                    if (registry.get("n" + i).isEmpty()) {
                      misses.incrementAndGet();
                    }
                  }
                }
                return null;
              }));
    }
    Future<?> writer =
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < count; i++) {
                registry.promote("n" + i);
              }
              return null;
            });

    start.countDown();
    writer.get(30, TimeUnit.SECONDS);
    done.set(true);
    for (Future<?> f : readers) {
      f.get(30, TimeUnit.SECONDS);
    }

    assertEquals(0, misses.get());
    assertEquals(count, ice.listAll().size());
    assertEquals(0, water.listAll().size());
    assertEquals(count, registry.getNodesByType("t").size());
  }

  @Test
  @DisplayName("concurrent writers of the same id serialise; the last write wins whole")
  void sameIdWritersSerialise() throws Exception {
    int writers = 8;
    int rounds = 100;
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int w = 0; w < writers; w++) {
      int id = w;
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int r = 0; r < rounds; r++) {
                  registry.upsert(
                      Node.builder("shared", "t")
                          .state(ContentState.WATER)
                          .meta("writer", id)
                          .meta("round", r)
                          .title("w" + id + "-r" + r)
                          .build());
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> f : futures) {
      f.get(30, TimeUnit.SECONDS);
    }

    Node last = registry.get("shared").orElseThrow();
    assertEquals("w" + last.metaValue("writer") + "-r" + last.metaValue("round"), last.title());
    assertEquals(1, water.listAll().size());
  }
}
