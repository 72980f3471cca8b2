package com.gentoro.autotag.classifier;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autotag.exception.ConfigException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class ClassifierFactoryTest {

  @Test
  void disabledClassifierIsUnavailable() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("classifier.enabled", false);

    try (Classifier classifier = ClassifierFactory.create(config)) {
      assertInstanceOf(UnavailableClassifier.class, classifier);
      assertTrue(classifier.analyze(Path.of("x.jpg")).isEmpty());
      assertEquals(PersonCategory.NONE, classifier.countPeople(Path.of("x.jpg")));
    }
  }

  @Test
  void enabledClassifierTalksHttp() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("classifier.endpoint", "http://inference:9000");

    try (Classifier classifier = ClassifierFactory.create(config)) {
      assertInstanceOf(HttpClassifier.class, classifier);
      assertTrue(classifier.name().contains("inference:9000"));
    }
  }

  @Test
  void settingsFromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("classifier.endpoint", " http://gpu-box:9100 ");
    config.setProperty("classifier.read-timeout-seconds", 120);
    config.setProperty("classifier.min-person-height", 64);
    config.addProperty("classifier.labels.scene", List.of("beach", "forest"));

    ClassifierSettings settings = ClassifierSettings.from(config);

    assertEquals("http://gpu-box:9100", settings.endpoint());
    assertEquals(Duration.ofSeconds(10), settings.connectTimeout());
    assertEquals(Duration.ofSeconds(120), settings.readTimeout());
    assertEquals(64, settings.minPersonHeight());
    assertEquals(List.of("beach", "forest"), settings.labels().get(Aspect.SCENE));
    assertEquals(
        ClassifierSettings.DEFAULT_LABELS.get(Aspect.ROOMTYPE),
        settings.labels().get(Aspect.ROOMTYPE));
  }

  @Test
  void rejectsBadSettings() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("classifier.connect-timeout-seconds", 0);
    assertThrows(ConfigException.class, () -> ClassifierSettings.from(config));

    BaseConfiguration badUrl = new BaseConfiguration();
    badUrl.setProperty("classifier.endpoint", "not a url");
    assertThrows(ConfigException.class, () -> ClassifierFactory.create(badUrl));
  }

  @Test
  void personCategoryFromCount() {
    assertEquals(PersonCategory.NONE, PersonCategory.fromCount(0));
    assertEquals(PersonCategory.SOLO, PersonCategory.fromCount(1));
    assertEquals(PersonCategory.GROUP, PersonCategory.fromCount(7));
    assertEquals("group", PersonCategory.GROUP.value());
  }
}
