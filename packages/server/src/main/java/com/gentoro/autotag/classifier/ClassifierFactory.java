package com.gentoro.autotag.classifier;

import org.apache.commons.configuration2.Configuration;

/** Builds the process-wide {@link Classifier} from configuration. */
public final class ClassifierFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(ClassifierFactory.class);

  private ClassifierFactory() {}

  public static Classifier create(Configuration config) {
    if (!config.getBoolean("classifier.enabled", true)) {
      log.warn("Classifier disabled; images will only receive a people/none tag");
      return new UnavailableClassifier();
    }
    ClassifierSettings settings = ClassifierSettings.from(config);
    log.info("Using classifier endpoint {}", settings.endpoint());
    return new HttpClassifier(settings);
  }
}
