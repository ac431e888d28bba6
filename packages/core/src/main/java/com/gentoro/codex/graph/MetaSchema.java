package com.gentoro.codex.graph;

import java.util.List;
import java.util.Map;

/** Required meta keys per well-known type id. Unknown types accept any meta. */
public final class MetaSchema {
  public static final String NEWS_ITEM = "news.item";
  public static final String NEWS_SOURCE = "news.source";
  public static final String CONTENT_TEXT = "content.text";
  public static final String CONTENT_SUMMARY = "content.summary";
  public static final String CONCEPT = "concept";
  public static final String ONTOLOGY_AXIS = "ontology.axis";
  public static final String META_TYPE = "codex.meta/type";

  /** Water TTL hint: ISO-8601 instant string or epoch millis. */
  public static final String EXPIRES_AT = "expiresAt";

  /** Set by the registry when a node enters GAS. */
  public static final String GAS_SINCE = "gasSince";

  private static final Map<String, List<String>> REQUIRED =
      Map.of(
          NEWS_ITEM, List.of("source", "publishedAt"),
          NEWS_SOURCE, List.of("sourceId"),
          CONTENT_TEXT, List.of("createdFrom"),
          CONTENT_SUMMARY, List.of("createdFrom"),
          CONCEPT, List.of("name", "createdFrom"),
          ONTOLOGY_AXIS, List.of("name", "band", "frequency"));

  private MetaSchema() {}

  public static List<String> requiredKeys(String typeId) {
    return REQUIRED.getOrDefault(typeId, List.of());
  }
}
