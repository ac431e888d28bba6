package com.gentoro.codex.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.codex.exception.ExternalServiceException;
import com.gentoro.codex.model.LlmClient;
import com.gentoro.codex.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ConceptExtractor} that asks an {@link LlmClient} for a strict JSON answer of the form
 * {@code {"concepts":[{"name":"...","score":0.0}]}}. A bare array is accepted too, as is prose
 * around the JSON.
 */
public class LlmConceptExtractor implements ConceptExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(LlmConceptExtractor.class);

  static final double DEFAULT_SCORE = 0.5;

  private static final String SYSTEM_PROMPT =
      """
      You extract key concepts from news summaries.
      Answer with JSON only, no prose, exactly in this shape:
      {"concepts":[{"name":"<short lowercase concept>","score":<confidence between 0 and 1>}]}
      Return at most %d concepts. Return {"concepts":[]} when nothing stands out.
      """;

  private final LlmClient llm;
  private final int maxConcepts;

  public LlmConceptExtractor(LlmClient llm, int maxConcepts) {
    this.llm = Objects.requireNonNull(llm, "llm");
    this.maxConcepts = maxConcepts;
  }

  @Override
  public List<ExtractedConcept> extractConcepts(String text) {
    if (text == null || text.isBlank()) return List.of();
    String reply =
        llm.chat(
            List.of(
                new LlmClient.Message(LlmClient.Role.SYSTEM, SYSTEM_PROMPT.formatted(maxConcepts)),
                new LlmClient.Message(LlmClient.Role.USER, text)));
    List<ExtractedConcept> concepts = parse(reply);
    log.debug("Model proposed {} concept(s)", concepts.size());
    return concepts.size() > maxConcepts ? concepts.subList(0, maxConcepts) : concepts;
  }

  static List<ExtractedConcept> parse(String reply) {
    if (reply == null || reply.isBlank()) {
      throw new ExternalServiceException("Empty reply from concept extraction model");
    }
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(extractJson(reply));
    } catch (JsonProcessingException e) {
      throw new ExternalServiceException("Concept extraction reply is not valid JSON", e);
    }
    JsonNode array = root.isArray() ? root : root.path("concepts");
    if (!array.isArray()) {
      throw new ExternalServiceException("Concept extraction reply has no 'concepts' array");
    }
    List<ExtractedConcept> out = new ArrayList<>();
    for (JsonNode n : array) {
      String name = n.isTextual() ? n.asText() : n.path("name").asText("");
      if (name.isBlank()) continue;
      double score = n.path("score").isNumber() ? n.path("score").asDouble() : DEFAULT_SCORE;
      out.add(new ExtractedConcept(name.trim(), Math.max(0.0, Math.min(1.0, score))));
    }
    return out;
  }

  private static String extractJson(String reply) {
    int obj = reply.indexOf('{');
    int arr = reply.indexOf('[');
    int start = obj < 0 ? arr : (arr < 0 ? obj : Math.min(obj, arr));
    if (start < 0) return reply;
    char close = reply.charAt(start) == '{' ? '}' : ']';
    int end = reply.lastIndexOf(close);
    return end > start ? reply.substring(start, end + 1) : reply.substring(start);
  }
}
