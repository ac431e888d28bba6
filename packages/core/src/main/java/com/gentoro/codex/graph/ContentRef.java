package com.gentoro.codex.graph;

import java.net.URI;
import java.util.Arrays;
import java.util.Objects;

/**
 * Reference to a node's payload: a media type plus at most one of inline JSON, inline bytes or an
 * external URI. The "at most one" rule is enforced by {@link GraphValidator}, not here, so that
 * malformed references can be reported with a proper error.
 */
public record ContentRef(String mediaType, String inlineJson, byte[] inlineBytes, URI externalUri) {

  public ContentRef {
    inlineBytes = inlineBytes == null ? null : inlineBytes.clone();
  }

  public static ContentRef json(String json) {
    return new ContentRef("application/json", json, null, null);
  }

  public static ContentRef text(String mediaType, String text) {
    return new ContentRef(
        mediaType,
        null,
        text == null ? null : text.getBytes(java.nio.charset.StandardCharsets.UTF_8),
        null);
  }

  public static ContentRef external(String mediaType, URI uri) {
    return new ContentRef(mediaType, null, null, uri);
  }

  /** A copy of the inline bytes, or {@code null}. */
  @Override
  public byte[] inlineBytes() {
    return inlineBytes == null ? null : inlineBytes.clone();
  }

  /** Number of populated payload variants; valid references have 0 or 1. */
  public int variantCount() {
    int n = 0;
    if (inlineJson != null) n++;
    if (inlineBytes != null) n++;
    if (externalUri != null) n++;
    return n;
  }

  /** Inline bytes decoded as UTF-8, or inline JSON, or {@code null}. */
  public String inlineText() {
    if (inlineBytes != null) {
      return new String(inlineBytes, java.nio.charset.StandardCharsets.UTF_8);
    }
    return inlineJson;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ContentRef other)) return false;
    return Objects.equals(mediaType, other.mediaType)
        && Objects.equals(inlineJson, other.inlineJson)
        && Arrays.equals(inlineBytes, other.inlineBytes)
        && Objects.equals(externalUri, other.externalUri);
  }

  @Override
  public int hashCode() {
    int h = Objects.hash(mediaType, inlineJson, externalUri);
    return 31 * h + Arrays.hashCode(inlineBytes);
  }

  @Override
  public String toString() {
    return "ContentRef{mediaType="
        + mediaType
        + (inlineJson != null ? ", inlineJson(" + inlineJson.length() + " chars)" : "")
        + (inlineBytes != null ? ", inlineBytes(" + inlineBytes.length + " bytes)" : "")
        + (externalUri != null ? ", externalUri=" + externalUri : "")
        + '}';
  }
}
