package com.gentoro.autotag;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autotag.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void bundledDefaults() {
    Configuration config = new ConfigurationProvider(null, Map.of()).config();

    assertEquals(8000, config.getInt("http.port"));
    assertEquals("0.0.0.0", config.getString("http.hostname"));
    assertEquals("append", config.getString("tagging.mode"));
    assertEquals("replace", config.getString("tagging.save-mode"));
    assertEquals("XMP-digiKam:TagsList", config.getString("tagging.exiftool.field"));
    assertEquals(30, config.getInt("tagging.exiftool.timeout-seconds"));
    assertFalse(config.getBoolean("tagging.apply-min-confidence"));
    assertEquals(
        List.of("kitchen", "bathroom", "bedroom", "living room", "office"),
        config.getList(String.class, "classifier.labels.roomtype"));
    assertEquals(10, config.getInt("batch.recent-status-capacity"));
    assertEquals("INFO", config.getString("logging.level.com.gentoro.autotag"));
  }

  @Test
  void fileFromCommandLine(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(
        file,
        """
        http:
          port: 9100
        tagging:
          save-mode: suffix
        """);

    Configuration config = new ConfigurationProvider(file, Map.of()).config();

    assertEquals(9100, config.getInt("http.port"));
    assertEquals("suffix", config.getString("tagging.save-mode"));
    assertEquals("append", config.getString("tagging.mode", "append"));
  }

  @Test
  void environmentOverridesFile() {
    Configuration config =
        new ConfigurationProvider(
                null,
                Map.of(
                    "AUTOTAG_PORT", "9999",
                    "AUTOTAG_SAVE_MODE", "suffix",
                    "AUTOTAG_EXIFTOOL_TIMEOUT", " 5 ",
                    "AUTOTAG_CLASSIFIER_ENABLED", "false",
                    "AUTOTAG_HOST", ""))
            .config();

    assertEquals(9999, config.getInt("http.port"));
    assertEquals("suffix", config.getString("tagging.save-mode"));
    assertEquals(5, config.getInt("tagging.exiftool.timeout-seconds"));
    assertFalse(config.getBoolean("classifier.enabled"));
    assertEquals("0.0.0.0", config.getString("http.hostname"));
  }

  @Test
  void missingFileFails(@TempDir Path dir) {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider(dir.resolve("nope.yaml"), Map.of()));
  }

  @Test
  void unreadableYamlFails(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "http: [unclosed\n  port: : :");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(file, Map.of()));
  }
}
