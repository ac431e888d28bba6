package com.gentoro.codex.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.exception.StorageUnavailableException;
import com.gentoro.codex.graph.ContentRef;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.storage.file.FileEdgeStore;
import com.gentoro.codex.storage.file.FileIceStore;
import com.gentoro.codex.storage.file.FileWaterStore;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStoresTest extends NodeStoreContract {

  @TempDir Path root;

  @Override
  protected IceStore iceStore() {
    return new FileIceStore(root.resolve("ice"));
  }

  @Override
  protected WaterStore waterStore() {
    return new FileWaterStore(root.resolve("water"));
  }

  @Override
  protected EdgeStore edgeStore() {
    return new FileEdgeStore(root.resolve("edges"));
  }

  @Test
  @DisplayName("nodes and edges survive a reopen")
  void persistsAcrossReopen() {
    IceStore ice = iceStore();
    WaterStore water = waterStore();
    EdgeStore edges = edgeStore();
    ice.initialize();
    water.initialize();
    edges.initialize();

    Node axis = ice("u-core-axis-science", "ontology.axis").withMetaEntry("frequency", 440.0);
    Node item =
        Node.builder("news/item?id=1", "news.item")
            .state(ContentState.WATER)
            .content(ContentRef.text("text/html", "<p>hello</p>"))
            .meta("source", "Reuters")
            .meta("publishedAt", "2026-01-01T00:00:00Z")
            .meta("tags", List.of("a", "b"))
            .build();
    Node ref =
        Node.builder("ref", "blob")
            .state(ContentState.WATER)
            .content(ContentRef.external("image/png", URI.create("https://example.org/x.png")))
            .build();
    ice.put(axis);
    water.put(item);
    water.put(ref);
    edges.put(new Edge(item.id(), axis.id(), "connects-to-ucore-via", 0.75));
    ice.close();
    water.close();
    edges.close();

    IceStore ice2 = iceStore();
    WaterStore water2 = waterStore();
    EdgeStore edges2 = edgeStore();
    ice2.initialize();
    water2.initialize();
    edges2.initialize();

    assertEquals(axis, ice2.get(axis.id()).orElseThrow());
    assertEquals(item, water2.get(item.id()).orElseThrow());
    assertEquals(ref, water2.get("ref").orElseThrow());
    assertEquals(
        List.of(new Edge(item.id(), axis.id(), "connects-to-ucore-via", 0.75)), edges2.listAll());
  }

  @Test
  void deleteRemovesFile() throws IOException {
    IceStore ice = iceStore();
    ice.initialize();
    ice.put(ice("a", "t"));
    assertEquals(1, jsonFiles(root.resolve("ice")));

    ice.delete("a");
    assertEquals(0, jsonFiles(root.resolve("ice")));
  }

  @Test
  @DisplayName("a corrupt record fails initialization instead of loading a partial node")
  void corruptFileFailsLoading() throws IOException {
    Files.createDirectories(root.resolve("ice"));
    Files.writeString(root.resolve("ice").resolve("YQ.json"), "{\"id\": \"a\", ");

    assertThrows(StorageUnavailableException.class, () -> iceStore().initialize());
  }

  @Test
  void leftoverTempFilesAreIgnored() throws IOException {
    Files.createDirectories(root.resolve("water"));
    Files.writeString(root.resolve("water").resolve("YQ.json.tmp"), "{\"id\": \"a\"");

    WaterStore water = waterStore();
    water.initialize();
    assertTrue(water.listAll().isEmpty());
    assertFalse(Files.exists(root.resolve("water").resolve("YQ.json.tmp")));
  }

  private static long jsonFiles(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files.filter(p -> p.toString().endsWith(".json")).count();
    }
  }
}
