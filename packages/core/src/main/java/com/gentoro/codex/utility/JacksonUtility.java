package com.gentoro.codex.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.codex.exception.SerializationException;

/**
 * Shared Jackson mappers.
 *
 * <p>{@link #getJsonMapper()} is compact and lenient on unknown properties; it is used for model
 * traffic and input files. {@link #getStorageMapper()} additionally orders map entries by key so
 * that a persisted node always produces the same document.
 */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER = baseMapper();

  private static final ObjectMapper STORAGE_MAPPER =
      baseMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private static final ObjectMapper REPORT_MAPPER =
      baseMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private JacksonUtility() {}

  private static ObjectMapper baseMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getStorageMapper() {
    return STORAGE_MAPPER;
  }

  /** Indented form for log output such as registry stats. */
  public static String toPrettyJson(Object value) {
    try {
      return REPORT_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Failed to render %s as JSON".formatted(value.getClass().getSimpleName()), e);
    }
  }
}
