package com.gentoro.codex.ingestion;

import java.util.Optional;

/** Resolves a source id to the display name used verbatim on ingested items. */
@FunctionalInterface
public interface SourceRegistry {
  Optional<String> resolveName(String sourceId);
}
