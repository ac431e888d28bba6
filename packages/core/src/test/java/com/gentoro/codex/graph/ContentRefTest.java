package com.gentoro.codex.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentRefTest {

  @Test
  @DisplayName("inline bytes cannot be changed through the constructor argument or the accessor")
  void inlineBytesAreCopied() {
    byte[] source = "hello".getBytes(StandardCharsets.UTF_8);
    ContentRef ref = new ContentRef("text/plain", null, source, null);

    source[0] = 'J';
    ref.inlineBytes()[1] = 'A';

    assertEquals("hello", ref.inlineText());
    assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), ref.inlineBytes());
    assertNotSame(ref.inlineBytes(), ref.inlineBytes());
  }

  @Test
  void equalityComparesByteContent() {
    ContentRef a = ContentRef.text("text/plain", "same");
    ContentRef b = ContentRef.text("text/plain", "same");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNull(ContentRef.json("{}").inlineBytes());
  }
}
