package com.gentoro.codex.ingestion;

import com.gentoro.codex.exception.ExceptionUtil;
import com.gentoro.codex.exception.ExternalServiceException;
import com.gentoro.codex.exception.IngestionCancelledException;
import com.gentoro.codex.exception.StateException;
import com.gentoro.codex.exception.ValidationException;
import com.gentoro.codex.graph.ContentRef;
import com.gentoro.codex.graph.ContentState;
import com.gentoro.codex.graph.Edge;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.ontology.Alignment;
import com.gentoro.codex.ontology.ConceptSymbolFactory;
import com.gentoro.codex.ontology.OntologyAligner;
import com.gentoro.codex.registry.NodeRegistry;
import com.gentoro.codex.resonance.ConceptSymbol;
import com.gentoro.codex.resonance.ResonanceEngine;
import com.gentoro.codex.utility.StringUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one raw item into the lineage {@code item -> content -> summary -> concepts -> axes}.
 *
 * <p>Node ids derive from the item id, and edges are keyed by (from, to, role), so running the
 * same item twice overwrites rather than duplicates. Only the first stage is fatal: later stage
 * failures are recorded on the item ({@code meta.pipelineErrors}) and the run continues with
 * what it has.
 *
 * <p>A run checks the thread's interrupt flag before every stage and stops with {@link
 * IngestionCancelledException}; nodes already written stay valid.
 */
public class IngestionPipeline implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(IngestionPipeline.class);

  public static final String ROLE_FROM_SOURCE = "from_source";
  public static final String ROLE_INSTANCE_OF = "instance-of";
  public static final String ROLE_HAS_CONTENT = "has-content";
  public static final String ROLE_SUMMARIZED_AS = "summarized-as";
  public static final String ROLE_CONTAINS_CONCEPT = "contains-concept";
  public static final String ROLE_CONNECTS_TO_UCORE = "connects-to-ucore-via";
  public static final String ROLE_CONNECTS_FROM_UCORE = "connects-from-ucore";

  public static final String CREATED_FROM_PIPELINE = "news-pipeline";
  public static final String UNKNOWN_SOURCE = "unknown";

  static final String STAGE_INGEST = "ingest";
  static final String STAGE_CONTENT = "content";
  static final String STAGE_SUMMARY = "summary";
  static final String STAGE_CONCEPTS = "concepts";
  static final String STAGE_ALIGNMENT = "alignment";

  private final NodeRegistry registry;
  private final ContentNormalizer normalizer;
  private final Summarizer summarizer;
  private final ConceptExtractor extractor;
  private final SourceRegistry sources;
  private final ResonanceEngine engine;
  private final OntologyAligner aligner;
  private final PipelineOptions options;
  private final Clock clock;
  private final ExecutorService extractionExecutor;

  public IngestionPipeline(
      NodeRegistry registry,
      ConceptExtractor extractor,
      SourceRegistry sources,
      ResonanceEngine engine,
      PipelineOptions options) {
    this(
        registry,
        new ContentNormalizer(),
        new ExtractiveSummarizer(options.summaryMaxSentences(), options.summaryMaxChars()),
        extractor,
        sources,
        engine,
        OntologyAligner.fromRegistry(engine, registry),
        options,
        Clock.systemUTC());
  }

  public IngestionPipeline(
      NodeRegistry registry,
      ContentNormalizer normalizer,
      Summarizer summarizer,
      ConceptExtractor extractor,
      SourceRegistry sources,
      ResonanceEngine engine,
      OntologyAligner aligner,
      PipelineOptions options,
      Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.sources = Objects.requireNonNull(sources, "sources");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.aligner = Objects.requireNonNull(aligner, "aligner");
    this.options = Objects.requireNonNull(options, "options");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.extractionExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "codex-extraction");
              t.setDaemon(true);
              return t;
            });
  }

  public static String contentId(String itemId) {
    return "content:" + itemId;
  }

  public static String summaryId(String itemId) {
    return "summary:" + itemId;
  }

  public static String sourceNodeId(String sourceId) {
    return "source:" + sourceId;
  }

  public static String typeNodeId(String typeId) {
    return "type:" + typeId;
  }

  public static String conceptId(String name) {
    return "concept:" + StringUtility.slug(name);
  }

  /**
   * Runs every stage for {@code item}.
   *
   * @throws ValidationException when the item itself is malformed
   * @throws StateException when the item was retired (GAS) and cannot be re-ingested
   * @throws IngestionCancelledException when the calling thread was interrupted
   */
  public IngestionResult ingest(RawItem item) {
    validate(item);
    String itemId = item.id();
    Map<String, String> errors = new LinkedHashMap<>();

    checkCancelled(itemId, STAGE_INGEST);
    Node itemNode = ingestItem(item, errors);
    log.debug("Ingested item '{}' from source '{}'", itemId, itemNode.metaString("source"));

    checkCancelled(itemId, STAGE_CONTENT);
    String normalized = null;
    String contentId = null;
    try {
      normalized = normalizer.normalize(item.content());
      contentId = writeContent(itemId, normalized);
    } catch (RuntimeException e) {
      recordError(errors, STAGE_CONTENT, itemId, e);
    }

    checkCancelled(itemId, STAGE_SUMMARY);
    String summaryText = null;
    String summaryId = null;
    try {
      String input = normalized != null ? normalized : Objects.toString(item.content(), "");
      summaryText = summarizer.summarize(input);
      summaryId = writeSummary(itemId, contentId, summaryText);
    } catch (RuntimeException e) {
      recordError(errors, STAGE_SUMMARY, itemId, e);
    }

    checkCancelled(itemId, STAGE_CONCEPTS);
    Map<String, Double> concepts = new LinkedHashMap<>();
    Map<String, String> conceptNames = new LinkedHashMap<>();
    try {
      String input = summaryText != null ? summaryText : Objects.toString(normalized, "");
      List<String> skipped = new ArrayList<>();
      for (ExtractedConcept candidate : extract(itemId, input)) {
        String id;
        try {
          id = resolveOrCreateConcept(candidate.name(), itemId);
        } catch (StateException e) {
          skipped.add(e.getMessage());
          continue;
        }
        if (id == null) continue;
        concepts.merge(id, candidate.score(), Math::max);
        conceptNames.putIfAbsent(id, candidate.name());
      }
      if (!skipped.isEmpty()) {
        errors.put(STAGE_CONCEPTS, String.join("; ", skipped));
      }
      if (summaryId != null) {
        for (Map.Entry<String, Double> c : concepts.entrySet()) {
          registry.upsert(new Edge(summaryId, c.getKey(), ROLE_CONTAINS_CONCEPT, c.getValue()));
        }
      }
    } catch (IngestionCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      recordError(errors, STAGE_CONCEPTS, itemId, e);
    }

    checkCancelled(itemId, STAGE_ALIGNMENT);
    Map<String, String> alignments = new LinkedHashMap<>();
    if (!concepts.isEmpty()) {
      alignments.putAll(align(itemId, concepts, conceptNames, errors));
    }

    IngestionResult.Status status =
        errors.isEmpty() ? IngestionResult.Status.COMPLETED : IngestionResult.Status.PARTIAL;
    finish(itemNode, new ArrayList<>(concepts.keySet()), errors, status);
    log.info(
        "Item '{}' processed: {} concept(s), status {}", itemId, concepts.size(), status);
    return new IngestionResult(
        itemId,
        contentId,
        summaryId,
        new ArrayList<>(concepts.keySet()),
        alignments,
        errors,
        status);
  }

  private void validate(RawItem item) {
    if (item == null) {
      throw new ValidationException("Raw item must not be null");
    }
    if (StringUtility.isBlank(item.id())) {
      throw new ValidationException("Raw item id must not be blank");
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Stage 1: item, source and type nodes
  // ---------------------------------------------------------------------------------------------

  private Node ingestItem(RawItem item, Map<String, String> errors) {
    String rawSource = StringUtility.isBlank(item.source()) ? UNKNOWN_SOURCE : item.source().trim();
    String sourceId = StringUtility.slug(rawSource);
    if (sourceId.isEmpty()) {
      sourceId = UNKNOWN_SOURCE;
    }
    String sourceName = rawSource;
    try {
      sourceName = sources.resolveName(sourceId).orElse(rawSource);
    } catch (RuntimeException e) {
      recordError(errors, STAGE_INGEST, item.id(), e);
    }
    String publishedAt =
        StringUtility.isBlank(item.publishedAt())
            ? clock.instant().toString()
            : item.publishedAt().trim();

    ContentState state = targetState(item.id(), ContentState.WATER);
    Node itemNode =
        Node.builder(item.id(), MetaSchema.NEWS_ITEM)
            .state(state)
            .title(item.title())
            .content(item.content() == null ? null : ContentRef.text("text/html", item.content()))
            .meta("source", sourceName)
            .meta("sourceId", sourceId)
            .meta("publishedAt", publishedAt)
            .meta("tags", item.tags())
            .meta("url", item.url())
            .meta("pipelineVersion", options.version())
            .meta("pipelineStatus", "processing")
            .build();
    Node stored = registry.upsert(itemNode);

    String sourceNodeId = sourceNodeId(sourceId);
    Optional<Node> existingSource = registry.get(sourceNodeId);
    if (existingSource.isEmpty() || existingSource.get().state() == ContentState.ICE) {
      registry.upsert(
          Node.builder(sourceNodeId, MetaSchema.NEWS_SOURCE)
              .state(ContentState.ICE)
              .title(sourceName)
              .meta("sourceId", sourceId)
              .meta("name", sourceName)
              .build());
    }

    String typeNodeId = typeNodeId(MetaSchema.NEWS_ITEM);
    if (registry.get(typeNodeId).isEmpty()) {
      registry.upsert(
          Node.builder(typeNodeId, MetaSchema.META_TYPE)
              .state(ContentState.ICE)
              .title(MetaSchema.NEWS_ITEM)
              .meta("typeId", MetaSchema.NEWS_ITEM)
              .build());
    }

    registry.upsert(new Edge(item.id(), sourceNodeId, ROLE_FROM_SOURCE));
    registry.upsert(new Edge(item.id(), typeNodeId, ROLE_INSTANCE_OF));
    return stored;
  }

  // ---------------------------------------------------------------------------------------------
  // Stages 2 and 3: derived text nodes
  // ---------------------------------------------------------------------------------------------

  private String writeContent(String itemId, String normalized) {
    String id = contentId(itemId);
    registry.upsert(
        Node.builder(id, MetaSchema.CONTENT_TEXT)
            .state(targetState(id, ContentState.WATER))
            .content(ContentRef.text("text/plain", normalized))
            .meta("createdFrom", itemId)
            .meta("length", normalized.length())
            .build());
    registry.upsert(new Edge(itemId, id, ROLE_HAS_CONTENT));
    return id;
  }

  private String writeSummary(String itemId, String contentId, String summary) {
    String id = summaryId(itemId);
    registry.upsert(
        Node.builder(id, MetaSchema.CONTENT_SUMMARY)
            .state(targetState(id, ContentState.WATER))
            .description(summary)
            .content(ContentRef.text("text/plain", summary))
            .meta("createdFrom", contentId != null ? contentId : itemId)
            .build());
    if (contentId != null) {
      registry.upsert(new Edge(contentId, id, ROLE_SUMMARIZED_AS));
    }
    return id;
  }

  // ---------------------------------------------------------------------------------------------
  // Stage 4: concepts
  // ---------------------------------------------------------------------------------------------

  private List<ExtractedConcept> extract(String itemId, String text) {
    if (text == null || text.isBlank()) return List.of();
    Future<List<ExtractedConcept>> call =
        extractionExecutor.submit(() -> extractor.extractConcepts(text));
    try {
      List<ExtractedConcept> result =
          call.get(options.extractionTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return result == null ? List.of() : result;
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new ExternalServiceException(
          "Concept extraction timed out after " + options.extractionTimeout().toMillis() + " ms",
          e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ExternalServiceException ese) throw ese;
      throw new ExternalServiceException("Concept extraction failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new IngestionCancelledException(itemId, STAGE_CONCEPTS);
    }
  }

  /** Returns the id of the concept node named {@code name}, creating it when absent. */
  private String resolveOrCreateConcept(String name, String itemId) {
    if (StringUtility.isBlank(name)) return null;
    String trimmed = name.trim();
    String candidateId = conceptId(trimmed);
    if (candidateId.equals("concept:")) return null;

    Optional<Node> direct = registry.get(candidateId);
    if (direct.isPresent() && direct.get().state() != ContentState.GAS) {
      return candidateId;
    }
    String lowered = trimmed.toLowerCase(Locale.ROOT);
    for (Node n : registry.getNodesByType(MetaSchema.CONCEPT)) {
      String existing = n.metaString("name");
      if (existing != null && existing.trim().toLowerCase(Locale.ROOT).equals(lowered)) {
        return n.id();
      }
    }
    if (direct.isPresent()) {
      // a retired concept keeps its id; do not resurrect it
      throw new StateException(
          "Concept '%s' is retired and cannot be linked".formatted(candidateId),
          Map.of("conceptId", candidateId));
    }
    registry.upsert(
        Node.builder(candidateId, MetaSchema.CONCEPT)
            .state(ContentState.ICE)
            .title(trimmed)
            .meta("name", trimmed)
            .meta("createdFrom", CREATED_FROM_PIPELINE)
            .meta("firstSeenIn", itemId)
            .build());
    log.debug("Created concept '{}'", candidateId);
    return candidateId;
  }

  // ---------------------------------------------------------------------------------------------
  // Stage 5: ontology alignment
  // ---------------------------------------------------------------------------------------------

  private Map<String, String> align(
      String itemId,
      Map<String, Double> concepts,
      Map<String, String> names,
      Map<String, String> errors) {
    Map<String, String> result = new LinkedHashMap<>();
    List<String> failures = new ArrayList<>();
    ConceptSymbolFactory symbols;
    try {
      symbols = new ConceptSymbolFactory(aligner.axes(), engine.bands());
    } catch (RuntimeException e) {
      recordError(errors, STAGE_ALIGNMENT, itemId, e);
      return result;
    }
    for (Map.Entry<String, Double> c : concepts.entrySet()) {
      String conceptId = c.getKey();
      try {
        ConceptSymbol symbol = symbols.symbolFor(names.get(conceptId), c.getValue());
        Optional<Alignment> alignment = aligner.align(symbol);
        if (alignment.isEmpty()) {
          failures.add(conceptId + ": no ontology axis available");
          continue;
        }
        String axisId = alignment.get().axisId();
        Map<String, Object> meta = Map.of("band", alignment.get().band());
        registry.upsert(
            new Edge(
                conceptId, axisId, ROLE_CONNECTS_TO_UCORE, alignment.get().resonance(), meta));
        registry.upsert(
            new Edge(
                axisId, conceptId, ROLE_CONNECTS_FROM_UCORE, alignment.get().resonance(), meta));
        result.put(conceptId, axisId);
      } catch (RuntimeException e) {
        failures.add(conceptId + ": " + ExceptionUtil.describe(e));
      }
    }
    if (!failures.isEmpty()) {
      errors.put(STAGE_ALIGNMENT, String.join("; ", failures));
      log.warn("Alignment incomplete for item '{}': {}", itemId, failures);
    }
    return result;
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  private void finish(
      Node itemNode,
      List<String> conceptIds,
      Map<String, String> errors,
      IngestionResult.Status status) {
    Node current = registry.get(itemNode.id()).orElse(itemNode);
    Map<String, Object> meta = new LinkedHashMap<>(current.meta());
    meta.put("pipelineVersion", options.version());
    meta.put("conceptIds", conceptIds);
    meta.put("pipelineStatus", status.name().toLowerCase(Locale.ROOT));
    meta.put("pipelineErrors", new LinkedHashMap<>(errors));
    meta.put("processedAt", Instant.now(clock).toString());
    registry.upsert(current.withMeta(meta));
  }

  /** Keeps an already promoted node in ICE; refuses to touch a retired one. */
  private ContentState targetState(String id, ContentState wanted) {
    Optional<Node> existing = registry.get(id);
    if (existing.isEmpty()) return wanted;
    return switch (existing.get().state()) {
      case ICE -> ContentState.ICE;
      case WATER -> wanted;
      case GAS -> throw new StateException(
          "Node '%s' is retired and cannot be re-ingested".formatted(id), Map.of("nodeId", id));
    };
  }

  private void recordError(
      Map<String, String> errors, String stage, String itemId, RuntimeException e) {
    if (e instanceof IngestionCancelledException cancelled) {
      throw cancelled;
    }
    errors.put(stage, ExceptionUtil.describe(e));
    log.warn("Stage '{}' failed for item '{}': {}", stage, itemId, e.getMessage());
  }

  private static void checkCancelled(String itemId, String stage) {
    if (Thread.currentThread().isInterrupted()) {
      throw new IngestionCancelledException(itemId, stage);
    }
  }

  @Override
  public void close() {
    extractionExecutor.shutdownNow();
  }
}
