package com.gentoro.codex.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A uniform graph vertex. Raw items, normalised content, summaries, concepts and ontology axes
 * are all nodes distinguished only by {@code typeId}.
 *
 * <p>Instances are immutable; "updates" produce a copy with the same id.
 */
public record Node(
    String id,
    String typeId,
    ContentState state,
    String locale,
    String title,
    String description,
    ContentRef content,
    Map<String, Object> meta) {

  public Node {
    meta =
        meta == null || meta.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }

  public Node withState(ContentState newState) {
    return new Node(id, typeId, newState, locale, title, description, content, meta);
  }

  public Node withMeta(Map<String, Object> newMeta) {
    return new Node(id, typeId, state, locale, title, description, content, newMeta);
  }

  /** Copy with one meta entry added or replaced. */
  public Node withMetaEntry(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(meta);
    m.put(key, value);
    return withMeta(m);
  }

  public Object metaValue(String key) {
    return meta.get(key);
  }

  public String metaString(String key) {
    Object v = meta.get(key);
    return v == null ? null : v.toString();
  }

  public static Builder builder(String id, String typeId) {
    return new Builder(id, typeId);
  }

  public Builder toBuilder() {
    Builder b = new Builder(id, typeId);
    b.state = state;
    b.locale = locale;
    b.title = title;
    b.description = description;
    b.content = content;
    b.meta.putAll(meta);
    return b;
  }

  public static final class Builder {
    private final String id;
    private final String typeId;
    private ContentState state = ContentState.WATER;
    private String locale;
    private String title;
    private String description;
    private ContentRef content;
    private final Map<String, Object> meta = new LinkedHashMap<>();

    private Builder(String id, String typeId) {
      this.id = id;
      this.typeId = typeId;
    }

    public Builder state(ContentState state) {
      this.state = Objects.requireNonNull(state, "state");
      return this;
    }

    public Builder locale(String locale) {
      this.locale = locale;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder content(ContentRef content) {
      this.content = content;
      return this;
    }

    public Builder meta(String key, Object value) {
      if (value != null) {
        this.meta.put(key, value);
      }
      return this;
    }

    public Builder meta(Map<String, ?> entries) {
      if (entries != null) {
        entries.forEach(this::meta);
      }
      return this;
    }

    public Node build() {
      return new Node(id, typeId, state, locale, title, description, content, meta);
    }
  }
}
