package com.gentoro.codex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * {@code env:} lookup for configuration placeholders. The process environment wins; otherwise the
 * first existing dotenv file ({@code KEY=value} lines, {@code #} comments, optional quotes) is
 * consulted. The file is read once, on the first miss.
 */
final class EnvironmentLookup implements Lookup {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(EnvironmentLookup.class);

  private final Function<String, String> environment;
  private final List<Path> dotenvCandidates;
  private volatile Map<String, String> dotenv;

  EnvironmentLookup(Function<String, String> environment, List<Path> dotenvCandidates) {
    this.environment = environment;
    this.dotenvCandidates = List.copyOf(dotenvCandidates);
  }

  static EnvironmentLookup standard() {
    return new EnvironmentLookup(
        System::getenv, List.of(Path.of(".env.local"), Path.of("packages/core/.env.local")));
  }

  @Override
  public Object lookup(String key) {
    String value = environment.apply(key);
    if (value != null && !value.isEmpty()) {
      return value;
    }
    return dotenv().get(key);
  }

  private Map<String, String> dotenv() {
    Map<String, String> loaded = dotenv;
    if (loaded == null) {
      synchronized (this) {
        if (dotenv == null) {
          dotenv = readFirstDotenv();
        }
        loaded = dotenv;
      }
    }
    return loaded;
  }

  private Map<String, String> readFirstDotenv() {
    for (Path candidate : dotenvCandidates) {
      if (!Files.isRegularFile(candidate)) continue;
      log.info("Reading environment fallback from {}", candidate.toAbsolutePath());
      try {
        return parse(Files.readAllLines(candidate, StandardCharsets.UTF_8));
      } catch (IOException e) {
        log.warn("Cannot read {}; ignoring it", candidate, e);
      }
    }
    return Map.of();
  }

  static Map<String, String> parse(List<String> lines) {
    Map<String, String> values = new HashMap<>();
    for (String raw : lines) {
      String line = raw.trim();
      int eq = line.indexOf('=');
      if (line.isEmpty() || line.startsWith("#") || eq <= 0) continue;
      String value = line.substring(eq + 1).trim();
      if (value.length() >= 2
          && (value.charAt(0) == '"' || value.charAt(0) == '\'')
          && value.charAt(value.length() - 1) == value.charAt(0)) {
        value = value.substring(1, value.length() - 1);
      }
      values.put(line.substring(0, eq).trim(), value);
    }
    return values;
  }
}
