package com.gentoro.codex;

import com.gentoro.codex.utility.StringUtility;
import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command line of {@link CodexApp}: {@code --config-file <location>}, {@code --mode
 * <seed|ingest|stats|cleanup>} and, for ingest, {@code --input <items.json>}. Both {@code --name
 * value} and {@code --name=value} are accepted.
 */
public class StartupParameters {

  public enum Mode {
    SEED,
    INGEST,
    STATS,
    CLEANUP;

    static Mode parse(String value) {
      try {
        return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException | NullPointerException e) {
        throw new IllegalArgumentException(
            "Invalid mode: %s (expected one of %s)"
                .formatted(
                    value,
                    Arrays.stream(values())
                        .map(m -> m.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", "))));
      }
    }
  }

  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final Mode mode;

  public StartupParameters(String[] arguments) {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "stats");
    parameters.putAll(parseArguments(arguments));

    this.mode = Mode.parse(parameters.get("mode"));
    if (StringUtility.isBlank(parameters.get("config-file"))) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if (mode == Mode.INGEST && StringUtility.isBlank(parameters.get("input"))) {
      throw new IllegalArgumentException("Mode 'ingest' requires --input <items.json>");
    }
  }

  private static Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new LinkedHashMap<>();
    for (int i = 0; i < arguments.length; i++) {
      String arg = arguments[i];
      if (!arg.startsWith("--")) continue;
      String name = arg.substring(2);
      int eq = name.indexOf('=');
      if (eq > 0) {
        result.put(name.substring(0, eq), name.substring(eq + 1));
      } else if (i + 1 < arguments.length && !arguments[i + 1].startsWith("--")) {
        result.put(name, arguments[++i]);
      } else {
        result.put(name, null);
      }
    }
    return result;
  }

  /** e.g. "classpath:application.yaml", "/etc/codex.yaml", "config/local.yaml". */
  public String configFile() {
    return parameters.get("config-file");
  }

  public Mode mode() {
    return mode;
  }

  public Optional<File> inputFile() {
    return getOptionalParameter("input").map(File::new);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
