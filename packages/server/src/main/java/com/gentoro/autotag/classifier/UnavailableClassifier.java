package com.gentoro.autotag.classifier;

import java.nio.file.Path;

/** Used when classification is disabled in configuration: every image yields no labels. */
public final class UnavailableClassifier implements Classifier {

  @Override
  public ClassificationResult analyze(Path image) {
    return ClassificationResult.empty();
  }

  @Override
  public PersonCategory countPeople(Path image) {
    return PersonCategory.NONE;
  }

  @Override
  public String name() {
    return "unavailable";
  }
}
