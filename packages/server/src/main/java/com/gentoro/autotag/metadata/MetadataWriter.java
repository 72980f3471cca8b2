package com.gentoro.autotag.metadata;

import com.gentoro.autotag.exception.AutoTagException;
import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.exception.ExceptionUtil;
import com.gentoro.autotag.exception.MetadataWriteException;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import com.gentoro.autotag.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Persists tags into image metadata by invoking ExifTool.
 *
 * <p>The invocation is {@code [tool, -<field>=<tags>|-<field>+=<tags>, -overwrite_original,
 * target]}, with tags comma-joined. Under {@link SaveMode#SUFFIX} the source is first copied to
 * {@code <stem>_tagged<ext>} and the copy is modified instead.
 *
 * <p>On any failure the result reports the original path, even if a suffix copy was already
 * created. That copy is left on disk.
 */
public class MetadataWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(MetadataWriter.class);

  public static final String DEFAULT_TOOL = "exiftool";
  public static final String DEFAULT_FIELD = "XMP-digiKam:TagsList";
  static final String OVERWRITE_ORIGINAL_FLAG = "-overwrite_original";

  private final String tool;
  private final String field;
  private final Duration defaultTimeout;
  private final CommandRunner runner;

  public MetadataWriter(String tool, String field, Duration defaultTimeout, CommandRunner runner) {
    this.tool = tool;
    this.field = field;
    this.defaultTimeout = defaultTimeout;
    this.runner = runner;
  }

  public static MetadataWriter from(Configuration config) {
    String tool = StringUtils.trimToNull(config.getString("tagging.exiftool.path", DEFAULT_TOOL));
    String field =
        StringUtils.trimToNull(config.getString("tagging.exiftool.field", DEFAULT_FIELD));
    int timeoutSeconds = config.getInt("tagging.exiftool.timeout-seconds", 30);
    if (tool == null || field == null) {
      throw new ConfigException("tagging.exiftool.path and tagging.exiftool.field must be set");
    }
    if (timeoutSeconds <= 0) {
      throw new ConfigException("tagging.exiftool.timeout-seconds must be positive");
    }
    return new MetadataWriter(
        tool, field, Duration.ofSeconds(timeoutSeconds), new CommandRunner());
  }

  public WriteResult write(Path source, List<String> tags, TagMode tagMode, SaveMode saveMode) {
    return write(source, tags, tagMode, saveMode, defaultTimeout);
  }

  public WriteResult write(
      Path source, List<String> tags, TagMode tagMode, SaveMode saveMode, Duration timeout) {
    if (tags == null || tags.isEmpty()) {
      log.warn("No tags to write to {}", source.getFileName());
      return WriteResult.success(source);
    }

    Path target = saveMode == SaveMode.SUFFIX
        ? FileUtility.withSuffix(source, SaveMode.SUFFIX_MARKER)
        : source;
    try {
      if (saveMode == SaveMode.SUFFIX) {
        copy(source, target);
      }

      CommandResult result = runner.run(command(target, tags, tagMode), timeout);
      if (!result.succeeded()) {
        throw failure(result, target, timeout);
      }

      log.info("Wrote {} tags to {}", tags.size(), target.getFileName());
      return WriteResult.success(target);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      if (e instanceof AutoTagException ex) {
        log.error(
            "Error writing tags to {} [{}]: {} {}",
            source.getFileName(),
            ex.getCode(),
            ex.getMessage(),
            ex.getContext());
      } else {
        log.error("Error writing tags to {}: {}", source.getFileName(), e.toString());
      }
      if (!target.equals(source) && Files.exists(target)) {
        log.warn("Tagged copy {} was left on disk after the failed write", target);
      }
      return WriteResult.failure(source, ExceptionUtil.describe(e));
    }
  }

  private static AutoTagException failure(CommandResult result, Path target, Duration timeout) {
    if (result.timedOut()) {
      return new MetadataWriteException(
              "ExifTool timed out after " + timeout.toSeconds() + "s on " + target.getFileName())
          .with("target", target);
    }
    return new MetadataWriteException(
            "ExifTool exited with code " + result.exitCode() + ": " + result.output())
        .with("target", target)
        .with("exit_code", result.exitCode());
  }

  /** Argument vector for one ExifTool invocation. */
  List<String> command(Path target, List<String> tags, TagMode tagMode) {
    String op = tagMode == TagMode.OVERWRITE ? "=" : "+=";
    String assignment = "-" + field + op + String.join(",", tags);
    return List.of(tool, assignment, OVERWRITE_ORIGINAL_FLAG, target.toString());
  }

  private static void copy(Path source, Path target) {
    try {
      Files.copy(
          source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    } catch (IOException e) {
      throw new MetadataWriteException("Failed to copy " + source + " to " + target, e);
    }
  }
}
