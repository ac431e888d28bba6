package com.gentoro.codex.ingestion;

import java.util.List;

/**
 * A raw news item as delivered by a feed.
 *
 * @param source raw source identifier or name; blank means "unknown"
 * @param publishedAt ISO-8601 instant as published; {@code null} means "now" at ingestion
 */
public record RawItem(
    String id,
    String title,
    String content,
    String source,
    String publishedAt,
    List<String> tags,
    String url) {

  public RawItem {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static RawItem of(String id, String title, String content) {
    return new RawItem(id, title, content, null, null, null, null);
  }
}
