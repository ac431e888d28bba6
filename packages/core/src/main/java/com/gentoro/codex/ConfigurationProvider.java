package com.gentoro.codex;

import com.gentoro.codex.exception.ConfigException;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration of a codex instance.
 *
 * <p>Locations: {@code classpath:<resource>}, a {@code file:} URI, or a plain path. A missing
 * classpath resource yields an empty configuration (all defaults); a missing file is an error.
 * {@code ${env:NAME}} placeholders resolve through {@link EnvironmentLookup}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String CLASSPATH_PREFIX = "classpath:";
  static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "application.yaml";

  private final String location;
  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, EnvironmentLookup.standard());
  }

  ConfigurationProvider(String location, Lookup envLookup) {
    this.location = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    YAMLConfiguration yaml =
        this.location.startsWith(CLASSPATH_PREFIX)
            ? fromClasspath(this.location.substring(CLASSPATH_PREFIX.length()))
            : fromFile(toFile(this.location));
    yaml.getInterpolator().registerLookup("env", envLookup);
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  /** The location the configuration was read from, after defaulting. */
  public String location() {
    return location;
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    URL url = Thread.currentThread().getContextClassLoader().getResource(resource);
    YAMLConfiguration yaml = new YAMLConfiguration();
    if (url == null) {
      log.info("No '{}' on the classpath; running with defaults", resource);
      return yaml;
    }
    log.info("Loading configuration from classpath resource {}", resource);
    try (Reader reader = new InputStreamReader(url.openStream(), StandardCharsets.UTF_8)) {
      yaml.read(reader);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Invalid YAML in classpath resource " + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from {}", file.getAbsolutePath());
    try {
      return new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
          .configure(new Parameters().fileBased().setFile(file))
          .getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + file, e);
    }
  }

  private static File toFile(String location) {
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return new File(URI.create(location));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + location, e);
      }
    }
    return new File(location);
  }
}
