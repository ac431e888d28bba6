package com.gentoro.codex.ingestion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codex.exception.ExternalServiceException;
import com.gentoro.codex.exception.IngestionCancelledException;
import com.gentoro.codex.exception.StateException;
import com.gentoro.codex.exception.ValidationException;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.ontology.OntologyAligner;
import com.gentoro.codex.ontology.OntologySeeder;
import com.gentoro.codex.registry.RegistryStats;
import com.gentoro.codex.registry.TieredNodeRegistry;
import com.gentoro.codex.resonance.ResonanceEngine;
import com.gentoro.codex.storage.memory.InMemoryEdgeStore;
import com.gentoro.codex.storage.memory.InMemoryIceStore;
import com.gentoro.codex.storage.memory.InMemoryWaterStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IngestionPipelineTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private static final RawItem QUANTUM =
      new RawItem(
          "n1",
          "Quantum breakthrough",
          "<p>Scientists announced a quantum breakthrough.</p><p>The research team shared new"
              + " data. More follows.</p>",
          "reuters",
          "2026-01-15T09:30:00Z",
          List.of("science"),
          "https://example.org/n1");

  private static final List<ExtractedConcept> QUANTUM_CONCEPTS =
      List.of(
          new ExtractedConcept("quantum", 0.9),
          new ExtractedConcept("breakthrough", 0.8),
          new ExtractedConcept("research", 0.7));

  private TieredNodeRegistry registry;
  private final ResonanceEngine engine = new ResonanceEngine();
  private SourceRegistry sources =
      id -> id.equals("reuters") ? Optional.of("Reuters World") : Optional.empty();
  private IngestionPipeline pipeline;

  @BeforeEach
  void setUp() {
    registry =
        new TieredNodeRegistry(
            new InMemoryIceStore(), new InMemoryWaterStore(), new InMemoryEdgeStore());
    registry.initialize();
    new OntologySeeder(registry).seedDefaults();
  }

  @AfterEach
  void tearDown() {
    if (pipeline != null) pipeline.close();
  }

  private IngestionPipeline pipeline(ConceptExtractor extractor, Duration timeout) {
    pipeline =
        new IngestionPipeline(
            registry,
            new ContentNormalizer(),
            new ExtractiveSummarizer(3, 600),
            extractor,
            sources,
            engine,
            OntologyAligner.fromRegistry(engine, registry),
            PipelineOptions.defaults().withExtractionTimeout(timeout),
            Clock.fixed(NOW, ZoneOffset.UTC));
    return pipeline;
  }

  private IngestionPipeline pipeline(ConceptExtractor extractor) {
    return pipeline(extractor, Duration.ofSeconds(5));
  }

  private long edgesFrom(String id, String role) {
    return registry.getEdgesFrom(id).stream().filter(e -> e.role().equals(role)).count();
  }

  @Test
  @DisplayName("a news item produces the full lineage down to the ontology axes")
  void fullLineage() {
    IngestionResult result = pipeline(text -> QUANTUM_CONCEPTS).ingest(QUANTUM);

    assertTrue(result.isCompleted(), () -> "errors: " + result.errors());
    assertEquals("content:n1", result.contentId());
    assertEquals("summary:n1", result.summaryId());
    assertEquals(
        List.of("concept:quantum", "concept:breakthrough", "concept:research"),
        result.conceptIds());
    assertEquals("u-core-axis-innovation", result.alignments().get("concept:breakthrough"));
    assertEquals("u-core-axis-science", result.alignments().get("concept:research"));
    assertTrue(result.alignments().containsKey("concept:quantum"));

    Node item = registry.get("n1").orElseThrow();
    assertEquals(ContentState.WATER, item.state());
    assertEquals("Reuters World", item.metaString("source"));
    assertEquals("reuters", item.metaString("sourceId"));
    assertEquals("2026-01-15T09:30:00Z", item.metaString("publishedAt"));
    assertEquals("completed", item.metaString("pipelineStatus"));
    assertEquals(PipelineOptions.DEFAULT_VERSION, item.metaString("pipelineVersion"));
    assertEquals(NOW.toString(), item.metaString("processedAt"));
    assertEquals(result.conceptIds(), item.metaValue("conceptIds"));

    Node content = registry.get("content:n1").orElseThrow();
    assertEquals(
        "Scientists announced a quantum breakthrough. The research team shared new data."
            + " More follows.",
        content.content().inlineText());
    assertEquals(ContentState.WATER, content.state());

    Node concept = registry.get("concept:quantum").orElseThrow();
    assertEquals(ContentState.ICE, concept.state());
    assertEquals("n1", concept.metaString("firstSeenIn"));
    assertEquals(IngestionPipeline.CREATED_FROM_PIPELINE, concept.metaString("createdFrom"));

    assertEquals(ContentState.ICE, registry.get("source:reuters").orElseThrow().state());
    assertEquals(
        MetaSchema.META_TYPE, registry.get("type:news.item").orElseThrow().typeId());

    assertEquals(1, edgesFrom("n1", IngestionPipeline.ROLE_FROM_SOURCE));
    assertEquals(1, edgesFrom("n1", IngestionPipeline.ROLE_INSTANCE_OF));
    assertEquals(1, edgesFrom("n1", IngestionPipeline.ROLE_HAS_CONTENT));
    assertEquals(1, edgesFrom("content:n1", IngestionPipeline.ROLE_SUMMARIZED_AS));
    assertEquals(3, edgesFrom("summary:n1", IngestionPipeline.ROLE_CONTAINS_CONCEPT));

    Edge toAxis =
        registry
            .getEdge(
                "concept:research", "u-core-axis-science", IngestionPipeline.ROLE_CONNECTS_TO_UCORE)
            .orElseThrow();
    assertEquals("low", toAxis.meta().get("band"));
    assertTrue(toAxis.weight() > 0.9);
    assertTrue(
        registry
            .getEdge(
                "u-core-axis-science",
                "concept:research",
                IngestionPipeline.ROLE_CONNECTS_FROM_UCORE)
            .isPresent());
  }

  @Test
  @DisplayName("re-running an item overwrites instead of duplicating")
  void rerunIsIdempotent() {
    IngestionPipeline p = pipeline(text -> QUANTUM_CONCEPTS);
    p.ingest(QUANTUM);
    RegistryStats first = registry.stats();

    p.ingest(QUANTUM);
    RegistryStats second = registry.stats();
    assertEquals(first.totalNodes(), second.totalNodes());
    assertEquals(first.edges(), second.edges());
    assertEquals(16, second.totalNodes());
    assertEquals(5 + 2 + 1 + 1 + 3 + 6, second.edges());
  }

  @Test
  @DisplayName("an extractor failure leaves a partial but consistent lineage")
  void extractorFailure() {
    IngestionResult result =
        pipeline(
                text -> {
                  throw new ExternalServiceException("model offline");
                })
            .ingest(QUANTUM);

    assertFalse(result.isCompleted());
    assertTrue(result.conceptIds().isEmpty());
    assertTrue(result.errors().get("concepts").contains("model offline"));
    assertEquals("summary:n1", result.summaryId());

    Node item = registry.get("n1").orElseThrow();
    assertEquals("partial", item.metaString("pipelineStatus"));
    assertTrue(((Map<?, ?>) item.metaValue("pipelineErrors")).containsKey("concepts"));
    assertEquals(0, edgesFrom("summary:n1", IngestionPipeline.ROLE_CONTAINS_CONCEPT));
  }

  @Test
  void extractorTimeoutIsRecorded() {
    IngestionResult result =
        pipeline(
                text -> {
                  try {
                    Thread.sleep(5_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return QUANTUM_CONCEPTS;
                },
                Duration.ofMillis(100))
            .ingest(QUANTUM);

    assertEquals(IngestionResult.Status.PARTIAL, result.status());
    assertTrue(result.errors().get("concepts").contains("timed out"));
  }

  @Test
  @DisplayName("unknown sources keep their raw name and missing fields get defaults")
  void sourceDefaults() {
    IngestionPipeline p = pipeline(text -> List.of());
    p.ingest(
        new RawItem("n2", "Garden", "A garden opened.", "Local Herald", null, null, null));
    p.ingest(RawItem.of("n3", "Untitled", "Nothing to see."));

    Node herald = registry.get("n2").orElseThrow();
    assertEquals("Local Herald", herald.metaString("source"));
    assertEquals("local-herald", herald.metaString("sourceId"));
    assertEquals(NOW.toString(), herald.metaString("publishedAt"));
    assertEquals("Local Herald", registry.get("source:local-herald").orElseThrow().title());

    Node anonymous = registry.get("n3").orElseThrow();
    assertEquals(IngestionPipeline.UNKNOWN_SOURCE, anonymous.metaString("source"));
    assertTrue(registry.get("source:unknown").isPresent());
  }

  @Test
  @DisplayName("a failing source lookup falls back to the raw source name")
  void sourceLookupFailureIsRecorded() {
    sources =
        id -> {
          throw new ExternalServiceException("source directory unavailable");
        };

    IngestionResult result = pipeline(text -> QUANTUM_CONCEPTS).ingest(QUANTUM);

    assertEquals(IngestionResult.Status.PARTIAL, result.status());
    assertTrue(result.errors().get("ingest").contains("source directory unavailable"));
    Node item = registry.get("n1").orElseThrow();
    assertEquals("reuters", item.metaString("source"));
    assertEquals("reuters", registry.get("source:reuters").orElseThrow().title());
    assertFalse(result.conceptIds().isEmpty());
  }

  @Test
  void existingConceptIsFoundByName() {
    registry.upsert(
        Node.builder("concept:qc", MetaSchema.CONCEPT)
            .state(ContentState.ICE)
            .meta("name", "Quantum")
            .meta("createdFrom", "manual")
            .build());

    IngestionResult result =
        pipeline(text -> List.of(new ExtractedConcept("quantum", 0.9))).ingest(QUANTUM);

    assertEquals(List.of("concept:qc"), result.conceptIds());
    assertTrue(registry.get("concept:quantum").isEmpty());
  }

  @Test
  @DisplayName("a retired concept is skipped while the others are linked")
  void retiredConceptIsSkipped() {
    IngestionPipeline p = pipeline(text -> QUANTUM_CONCEPTS);
    p.ingest(QUANTUM);
    registry.delete("concept:quantum");

    IngestionResult result =
        p.ingest(new RawItem("n4", "More", "More quantum news.", "reuters", null, null, null));

    assertEquals(List.of("concept:breakthrough", "concept:research"), result.conceptIds());
    assertTrue(result.errors().get("concepts").contains("concept:quantum"));
    assertEquals(ContentState.GAS, registry.get("concept:quantum").orElseThrow().state());
  }

  @Test
  void promotedItemStaysIce() {
    IngestionPipeline p = pipeline(text -> List.of());
    p.ingest(QUANTUM);
    registry.promote("n1");

    p.ingest(QUANTUM);
    assertEquals(ContentState.ICE, registry.get("n1").orElseThrow().state());
  }

  @Test
  void retiredItemCannotBeReingested() {
    IngestionPipeline p = pipeline(text -> List.of());
    p.ingest(QUANTUM);
    registry.delete("n1");

    assertThrows(StateException.class, () -> p.ingest(QUANTUM));
  }

  @Test
  void malformedItemIsRejected() {
    IngestionPipeline p = pipeline(text -> List.of());
    assertThrows(ValidationException.class, () -> p.ingest(null));
    assertThrows(ValidationException.class, () -> p.ingest(RawItem.of(" ", "t", "c")));
  }

  @Test
  @DisplayName("an interrupted thread stops before the first stage")
  void interruptedBeforeStart() {
    IngestionPipeline p = pipeline(text -> QUANTUM_CONCEPTS);
    Thread.currentThread().interrupt();
    try {
      IngestionCancelledException e =
          assertThrows(IngestionCancelledException.class, () -> p.ingest(QUANTUM));
      assertEquals("ingest", e.getContext().get("stage"));
    } finally {
      Thread.interrupted();
    }
    assertTrue(registry.get("n1").isEmpty());
  }
}
