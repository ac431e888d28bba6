package com.gentoro.codex;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.codex.exception.CodexException;
import com.gentoro.codex.exception.ConfigException;
import com.gentoro.codex.exception.ExceptionUtil;
import com.gentoro.codex.exception.SerializationException;
import com.gentoro.codex.exception.StateException;
import com.gentoro.codex.ingestion.ConceptExtractor;
import com.gentoro.codex.ingestion.ConfiguredSourceRegistry;
import com.gentoro.codex.ingestion.IngestionPipeline;
import com.gentoro.codex.ingestion.IngestionResult;
import com.gentoro.codex.ingestion.IngestionService;
import com.gentoro.codex.ingestion.LlmConceptExtractor;
import com.gentoro.codex.ingestion.PipelineOptions;
import com.gentoro.codex.ingestion.RawItem;
import com.gentoro.codex.ingestion.SourceRegistry;
import com.gentoro.codex.model.LlmClientFactory;
import com.gentoro.codex.ontology.OntologySeeder;
import com.gentoro.codex.registry.CleanupReport;
import com.gentoro.codex.registry.GasRetentionPolicy;
import com.gentoro.codex.registry.NodeRegistry;
import com.gentoro.codex.registry.RegistryStats;
import com.gentoro.codex.registry.TieredNodeRegistry;
import com.gentoro.codex.resonance.ResonanceEngine;
import com.gentoro.codex.storage.StorageBackendFactory;
import com.gentoro.codex.utility.JacksonUtility;
import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: wires configuration, storage, the registry, the resonance engine and the
 * ingestion pipeline, and runs the selected startup mode.
 */
public class Codex {

  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(Codex.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private NodeRegistry registry;
  private ResonanceEngine resonanceEngine;
  private IngestionPipeline pipeline;
  private IngestionService ingestionService;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public Codex(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = createConfigurationProvider();
    com.gentoro.codex.logging.LoggingService.applyConfiguration(configuration());

    Configuration cfg = configuration();
    this.registry =
        new TieredNodeRegistry(
            StorageBackendFactory.createIceStore(cfg),
            StorageBackendFactory.createWaterStore(cfg),
            StorageBackendFactory.createEdgeStore(cfg),
            GasRetentionPolicy.fromConfiguration(cfg),
            Clock.systemUTC());
    registry.initialize();

    this.resonanceEngine = ResonanceEngine.fromConfiguration(cfg);

    if (cfg.getBoolean("ontology.seedOnStartup", true)) {
      new OntologySeeder(registry).seedDefaults();
    }
  }

  /** Runs the mode selected on the command line. */
  public void run() {
    switch (startupParameters.mode()) {
      case SEED -> new OntologySeeder(registry()).seedDefaults();
      case INGEST -> ingestFile(startupParameters.inputFile().orElseThrow());
      case STATS ->
          log.info("Registry stats:\n{}", JacksonUtility.toPrettyJson(registry().stats()));
      case CLEANUP -> {
        CleanupReport report = registry().cleanupExpired();
        log.info("Cleanup report:\n{}", JacksonUtility.toPrettyJson(report));
      }
    }
  }

  /** Ingests every item of a JSON array file and waits for all of them. */
  public List<IngestionResult> ingestFile(File input) {
    List<RawItem> items;
    try {
      items =
          JacksonUtility.getJsonMapper().readValue(input, new TypeReference<List<RawItem>>() {});
    } catch (IOException e) {
      throw new SerializationException("Failed to read items from " + input, e);
    }
    log.info("Ingesting {} item(s) from {}", items.size(), input);

    List<IngestionResult> results = new ArrayList<>();
    List<CompletableFuture<IngestionResult>> futures = ingestionService().submitAll(items);
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException e) {
        log.error(
            "Item '{}' failed: {}", items.get(i).id(), ExceptionUtil.describe(e));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        throw new StateException("Interrupted while waiting for ingestion to finish");
      }
    }
    long completed = results.stream().filter(IngestionResult::isCompleted).count();
    log.info(
        "Ingestion finished: {} completed, {} partial, {} failed",
        completed,
        results.size() - completed,
        items.size() - results.size());
    return results;
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      closeLogging(ingestionService);
      if (ingestionService == null) {
        closeLogging(pipeline);
      }
      closeLogging(registry);
    }
  }

  private void closeLogging(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  protected ConfigurationProvider createConfigurationProvider() {
    return new ConfigurationProvider(startupParameters.configFile());
  }

  protected ConceptExtractor createConceptExtractor() {
    return new LlmConceptExtractor(
        LlmClientFactory.createProvider(configuration()),
        PipelineOptions.fromConfiguration(configuration()).maxConcepts());
  }

  protected SourceRegistry createSourceRegistry() {
    return new ConfiguredSourceRegistry(configuration());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Codex not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public NodeRegistry registry() {
    if (registry == null) {
      throw new StateException("Codex not initialized. Call initialize() first.");
    }
    return registry;
  }

  public ResonanceEngine resonanceEngine() {
    return resonanceEngine;
  }

  /** The pipeline is built on first use so that non-ingest modes never need an LLM. */
  public synchronized IngestionPipeline pipeline() {
    if (pipeline == null) {
      PipelineOptions options = PipelineOptions.fromConfiguration(configuration());
      try {
        this.pipeline =
            new IngestionPipeline(
                registry(),
                createConceptExtractor(),
                createSourceRegistry(),
                resonanceEngine,
                options);
      } catch (CodexException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new ConfigException("Could not build the ingestion pipeline", e);
      }
    }
    return pipeline;
  }

  public synchronized IngestionService ingestionService() {
    if (ingestionService == null) {
      this.ingestionService =
          new IngestionService(
              pipeline(), PipelineOptions.fromConfiguration(configuration()).workers());
    }
    return ingestionService;
  }
}
