package com.gentoro.codex.registry;

import com.gentoro.codex.exception.ConfigException;
import com.gentoro.codex.graph.MetaSchema;
import com.gentoro.codex.graph.Node;
import com.gentoro.codex.graph.NodeExpiry;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Decides whether a GAS node may be physically removed.
 *
 * <pre>
 *   registry:
 *     gas:
 *       retention: purge-after   # or "retain" (default)
 *       retentionPeriod: P30D
 * </pre>
 */
public final class GasRetentionPolicy {
  public enum Mode {
    RETAIN,
    PURGE_AFTER
  }

  private final Mode mode;
  private final Duration period;

  private GasRetentionPolicy(Mode mode, Duration period) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.period = period;
  }

  public static GasRetentionPolicy retain() {
    return new GasRetentionPolicy(Mode.RETAIN, null);
  }

  public static GasRetentionPolicy purgeAfter(Duration period) {
    if (period == null || period.isNegative()) {
      throw new ConfigException("Gas retention period must be a non-negative duration");
    }
    return new GasRetentionPolicy(Mode.PURGE_AFTER, period);
  }

  public static GasRetentionPolicy fromConfiguration(Configuration config) {
    String raw = config.getString("registry.gas.retention", "retain").trim();
    switch (raw.toLowerCase(Locale.ROOT)) {
      case "retain":
        return retain();
      case "purge-after":
        String p = config.getString("registry.gas.retentionPeriod", null);
        if (p == null || p.isBlank()) {
          throw new ConfigException(
              "registry.gas.retentionPeriod is required when retention is 'purge-after'");
        }
        try {
          return purgeAfter(Duration.parse(p.trim()));
        } catch (DateTimeParseException e) {
          throw new ConfigException("Invalid registry.gas.retentionPeriod: " + p, e);
        }
      default:
        throw new ConfigException("Unknown registry.gas.retention: " + raw);
    }
  }

  public Mode mode() {
    return mode;
  }

  /** GAS nodes without a readable {@code gasSince} are never purged. */
  public boolean isPurgeable(Node node, Instant now) {
    if (mode == Mode.RETAIN) return false;
    return NodeExpiry.readInstant(node.metaValue(MetaSchema.GAS_SINCE))
        .map(since -> !since.plus(period).isAfter(now))
        .orElse(false);
  }

  @Override
  public String toString() {
    return mode == Mode.RETAIN ? "retain" : "purge-after " + period;
  }
}
