package com.gentoro.codex.ingestion;

@FunctionalInterface
public interface Summarizer {
  String summarize(String text);
}
