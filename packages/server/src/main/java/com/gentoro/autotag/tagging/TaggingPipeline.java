package com.gentoro.autotag.tagging;

import com.gentoro.autotag.classifier.ClassificationResult;
import com.gentoro.autotag.classifier.Classifier;
import com.gentoro.autotag.classifier.PersonCategory;
import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.exception.ValidationException;
import com.gentoro.autotag.image.ImageValidator;
import com.gentoro.autotag.image.ValidationResult;
import com.gentoro.autotag.metadata.MetadataWriter;
import com.gentoro.autotag.metadata.WriteResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Single-image flow: validate, classify, synthesize tags, write metadata.
 *
 * <p>Shared by the upload endpoint and the batch orchestrator. Validation is a separate step
 * because callers hold the bytes in different ways; {@link #process} assumes a validated file on
 * disk.
 */
public class TaggingPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(TaggingPipeline.class);

  static final String WRITE_FAILED = "Failed to write metadata";

  private final ImageValidator validator;
  private final Classifier classifier;
  private final TagSynthesizer synthesizer;
  private final MetadataWriter writer;
  private final TagMode defaultTagMode;
  private final SaveMode defaultSaveMode;

  public TaggingPipeline(
      ImageValidator validator,
      Classifier classifier,
      TagSynthesizer synthesizer,
      MetadataWriter writer,
      TagMode defaultTagMode,
      SaveMode defaultSaveMode) {
    this.validator = validator;
    this.classifier = classifier;
    this.synthesizer = synthesizer;
    this.writer = writer;
    this.defaultTagMode = defaultTagMode;
    this.defaultSaveMode = defaultSaveMode;
  }

  public static TaggingPipeline from(Configuration config, Classifier classifier) {
    TagMode tagMode;
    SaveMode saveMode;
    try {
      tagMode = TagMode.parse(config.getString("tagging.mode", "append"));
      saveMode = SaveMode.parse(config.getString("tagging.save-mode", "replace"));
    } catch (ValidationException e) {
      throw new ConfigException("Invalid tagging configuration: " + e.getMessage(), e);
    }

    TagSynthesizer synthesizer;
    if (config.getBoolean("tagging.apply-min-confidence", false)) {
      double floor = config.getDouble("tagging.min-confidence-percent", 80.0);
      if (floor < 0 || floor > 100) {
        throw new ConfigException("tagging.min-confidence-percent must be between 0 and 100");
      }
      synthesizer = new TagSynthesizer(floor);
    } else {
      synthesizer = new TagSynthesizer();
    }

    return new TaggingPipeline(
        new ImageValidator(),
        classifier,
        synthesizer,
        MetadataWriter.from(config),
        tagMode,
        saveMode);
  }

  public ValidationResult validate(byte[] content, String filename) {
    return validator.validate(content, filename);
  }

  public ProcessingOutcome process(Path image, TagMode tagMode, SaveMode saveMode) {
    long start = System.nanoTime();

    ClassificationResult classification = classifier.analyze(image);
    PersonCategory people = classifier.countPeople(image);
    List<String> tags = synthesizer.synthesize(classification, people);
    log.debug("Tags for {}: {}", image.getFileName(), tags);

    WriteResult written = writer.write(image, tags, tagMode, saveMode);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

    if (!written.success()) {
      String reason =
          written.error() == null ? WRITE_FAILED : WRITE_FAILED + ": " + written.error();
      return new ProcessingOutcome(false, tags, written.path(), reason, elapsed);
    }
    return new ProcessingOutcome(true, tags, written.path(), null, elapsed);
  }

  public TagMode defaultTagMode() {
    return defaultTagMode;
  }

  public SaveMode defaultSaveMode() {
    return defaultSaveMode;
  }
}
