package com.gentoro.codex.ingestion;

import java.util.regex.Pattern;
import org.apache.commons.text.StringEscapeUtils;

/** Turns raw (possibly HTML) item content into plain, single-spaced text. */
public class ContentNormalizer {
  private static final Pattern SCRIPT_OR_STYLE =
      Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1\\s*>");
  private static final Pattern BLOCK_BREAK =
      Pattern.compile("(?i)<\\s*(br|/p|/div|/li|/h[1-6])\\s*/?>");
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String normalize(String raw) {
    if (raw == null) return "";
    String text = SCRIPT_OR_STYLE.matcher(raw).replaceAll(" ");
    text = BLOCK_BREAK.matcher(text).replaceAll(" ");
    text = TAG.matcher(text).replaceAll("");
    text = StringEscapeUtils.unescapeHtml4(text).replace('\u00A0', ' ');
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }
}
