package com.gentoro.autotag;

import com.gentoro.autotag.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration.
 *
 * <p>Precedence, highest first: {@code AUTOTAG_*} environment variables, the YAML file given on
 * the command line (or the bundled {@code application.yaml}), then the defaults passed at each
 * lookup site.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  /** Environment variable to configuration key. */
  static final Map<String, String> ENV_MAPPING = new LinkedHashMap<>();

  static {
    ENV_MAPPING.put("AUTOTAG_PORT", "http.port");
    ENV_MAPPING.put("AUTOTAG_HOST", "http.hostname");
    ENV_MAPPING.put("AUTOTAG_TAG_MODE", "tagging.mode");
    ENV_MAPPING.put("AUTOTAG_SAVE_MODE", "tagging.save-mode");
    ENV_MAPPING.put("AUTOTAG_MIN_CONFIDENCE", "tagging.min-confidence-percent");
    ENV_MAPPING.put("AUTOTAG_EXIFTOOL_TIMEOUT", "tagging.exiftool.timeout-seconds");
    ENV_MAPPING.put("AUTOTAG_EXIFTOOL_PATH", "tagging.exiftool.path");
    ENV_MAPPING.put("AUTOTAG_CLASSIFIER_ENDPOINT", "classifier.endpoint");
    ENV_MAPPING.put("AUTOTAG_CLASSIFIER_ENABLED", "classifier.enabled");
  }

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this(configFile, System.getenv());
  }

  ConfigurationProvider(Path configFile, Map<String, String> environment) {
    this.config = load(configFile);
    applyEnvironment(environment);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration load(Path configFile) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigException("Configuration file not found: " + configFile);
      }
      log.info("Loading configuration from {}", configFile.toAbsolutePath());
      try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      } catch (Exception e) {
        throw new ConfigException("Failed to read configuration file " + configFile, e);
      }
      return yaml;
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
        return yaml;
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      }
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled " + DEFAULT_RESOURCE, e);
    }
    return yaml;
  }

  private void applyEnvironment(Map<String, String> environment) {
    if (environment == null) {
      return;
    }
    ENV_MAPPING.forEach(
        (variable, key) -> {
          String value = environment.get(variable);
          if (value != null && !value.isBlank()) {
            log.debug("Overriding {} from environment variable {}", key, variable);
            config.setProperty(key, value.trim());
          }
        });
  }
}
