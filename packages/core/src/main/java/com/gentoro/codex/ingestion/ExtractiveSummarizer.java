package com.gentoro.codex.ingestion;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Leading-sentences summary: the first few sentences, capped at a character budget. */
public class ExtractiveSummarizer implements Summarizer {
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

  private final int maxSentences;
  private final int maxChars;

  public ExtractiveSummarizer(int maxSentences, int maxChars) {
    if (maxSentences <= 0 || maxChars <= 0) {
      throw new IllegalArgumentException("maxSentences and maxChars must be positive");
    }
    this.maxSentences = maxSentences;
    this.maxChars = maxChars;
  }

  @Override
  public String summarize(String text) {
    if (text == null || text.isBlank()) return "";
    List<String> picked = new ArrayList<>();
    for (String sentence : SENTENCE_END.split(text.trim())) {
      if (sentence.isBlank()) continue;
      picked.add(sentence.trim());
      if (picked.size() == maxSentences) break;
    }
    String summary = String.join(" ", picked);
    if (summary.length() <= maxChars) return summary;

    String cut = summary.substring(0, maxChars);
    int lastSpace = cut.lastIndexOf(' ');
    if (lastSpace > maxChars / 2) {
      cut = cut.substring(0, lastSpace);
    }
    return cut.stripTrailing() + "...";
  }
}
