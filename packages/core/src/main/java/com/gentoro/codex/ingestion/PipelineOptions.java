package com.gentoro.codex.ingestion;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the ingestion pipeline, read from the {@code pipeline.*} keys.
 *
 * @param version recorded on every processed item as {@code meta.pipelineVersion}
 */
public record PipelineOptions(
    String version,
    Duration extractionTimeout,
    int summaryMaxSentences,
    int summaryMaxChars,
    int maxConcepts,
    int workers) {

  public static final String DEFAULT_VERSION = "1.0";

  public static PipelineOptions defaults() {
    return new PipelineOptions(DEFAULT_VERSION, Duration.ofSeconds(30), 3, 600, 10, 4);
  }

  public static PipelineOptions fromConfiguration(Configuration config) {
    PipelineOptions d = defaults();
    return new PipelineOptions(
        config.getString("pipeline.version", d.version()),
        Duration.ofMillis(
            config.getLong("pipeline.extraction.timeoutMs", d.extractionTimeout().toMillis())),
        config.getInt("pipeline.summary.maxSentences", d.summaryMaxSentences()),
        config.getInt("pipeline.summary.maxChars", d.summaryMaxChars()),
        config.getInt("pipeline.extraction.maxConcepts", d.maxConcepts()),
        config.getInt("pipeline.workers", d.workers()));
  }

  public PipelineOptions withExtractionTimeout(Duration timeout) {
    return new PipelineOptions(
        version, timeout, summaryMaxSentences, summaryMaxChars, maxConcepts, workers);
  }
}
