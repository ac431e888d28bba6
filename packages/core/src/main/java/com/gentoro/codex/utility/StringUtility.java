package com.gentoro.codex.utility;

import java.util.Locale;

public final class StringUtility {
  private StringUtility() {}

  /**
   * Lower-case, dash-separated form of a display name, suitable for deterministic node ids.
   * {@code "Quantum  Computing!"} becomes {@code "quantum-computing"}.
   */
  public static String slug(String input) {
    if (input == null) return "";
    String lowered = input.trim().toLowerCase(Locale.ROOT);
    String dashed = lowered.replaceAll("[^\\p{L}\\p{N}]+", "-");
    return dashed.replaceAll("^-+|-+$", "");
  }

  public static boolean isBlank(String input) {
    return input == null || input.isBlank();
  }

  public static String truncate(String input, int limit) {
    if (input == null || input.length() <= limit) return input;
    return input.substring(0, Math.max(0, limit));
  }
}
