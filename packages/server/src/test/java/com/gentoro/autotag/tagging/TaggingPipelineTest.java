package com.gentoro.autotag.tagging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.autotag.classifier.Aspect;
import com.gentoro.autotag.classifier.ClassificationResult;
import com.gentoro.autotag.classifier.Classifier;
import com.gentoro.autotag.classifier.LabelScore;
import com.gentoro.autotag.classifier.PersonCategory;
import com.gentoro.autotag.classifier.UnavailableClassifier;
import com.gentoro.autotag.exception.ConfigException;
import com.gentoro.autotag.image.ImageValidator;
import com.gentoro.autotag.metadata.MetadataWriter;
import com.gentoro.autotag.metadata.WriteResult;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaggingPipelineTest {

  private final Path image = Path.of("/photos/kitchen.jpg");
  private Classifier classifier;
  private MetadataWriter writer;
  private TaggingPipeline pipeline;

  @BeforeEach
  void setUp() {
    classifier = mock(Classifier.class);
    writer = mock(MetadataWriter.class);
    pipeline =
        new TaggingPipeline(
            new ImageValidator(),
            classifier,
            new TagSynthesizer(),
            writer,
            TagMode.APPEND,
            SaveMode.REPLACE);
    when(classifier.analyze(image))
        .thenReturn(
            ClassificationResult.of(
                Map.of(
                    Aspect.SCENE, new LabelScore("indoor", 0.9),
                    Aspect.ROOMTYPE, new LabelScore("kitchen", 0.8))));
    when(classifier.countPeople(image)).thenReturn(PersonCategory.NONE);
  }

  @Test
  void writesSynthesizedTags() {
    Path tagged = Path.of("/photos/kitchen_tagged.jpg");
    List<String> expected = List.of("scene/indoor", "roomtype/kitchen", "people/none");
    when(writer.write(image, expected, TagMode.OVERWRITE, SaveMode.SUFFIX))
        .thenReturn(WriteResult.success(tagged));

    ProcessingOutcome outcome = pipeline.process(image, TagMode.OVERWRITE, SaveMode.SUFFIX);

    assertTrue(outcome.success());
    assertEquals(expected, outcome.tags());
    assertEquals(tagged, outcome.outputPath());
    assertNull(outcome.error());
    assertTrue(outcome.elapsedSeconds() >= 0);
  }

  @Test
  void writeFailureFailsTheImage() {
    when(writer.write(any(), anyList(), any(), any()))
        .thenReturn(WriteResult.failure(image, "ExifTool exited with code 1"));

    ProcessingOutcome outcome = pipeline.process(image, TagMode.APPEND, SaveMode.REPLACE);

    assertFalse(outcome.success());
    assertEquals(image, outcome.outputPath());
    assertEquals("Failed to write metadata: ExifTool exited with code 1", outcome.error());
  }

  @Test
  void fromConfigurationAppliesModesAndFloor() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("tagging.mode", "overwrite");
    config.setProperty("tagging.save-mode", "suffix");
    config.setProperty("tagging.apply-min-confidence", true);
    config.setProperty("tagging.min-confidence-percent", 50);

    TaggingPipeline fromConfig = TaggingPipeline.from(config, new UnavailableClassifier());

    assertEquals(TagMode.OVERWRITE, fromConfig.defaultTagMode());
    assertEquals(SaveMode.SUFFIX, fromConfig.defaultSaveMode());
  }

  @Test
  void invalidModeIsAConfigError() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("tagging.mode", "merge");

    assertThrows(ConfigException.class, () -> TaggingPipeline.from(config, classifier));
  }

  @Test
  void modesParseCaseInsensitively() {
    assertEquals(TagMode.OVERWRITE, TagMode.parse(" Overwrite "));
    assertEquals(SaveMode.SUFFIX, SaveMode.parse("SUFFIX"));
    assertThrows(
        com.gentoro.autotag.exception.ValidationException.class, () -> SaveMode.parse("copy"));
  }
}
