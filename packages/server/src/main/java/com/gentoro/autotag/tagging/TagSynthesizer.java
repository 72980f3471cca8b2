package com.gentoro.autotag.tagging;

import com.gentoro.autotag.classifier.Aspect;
import com.gentoro.autotag.classifier.ClassificationResult;
import com.gentoro.autotag.classifier.LabelScore;
import com.gentoro.autotag.classifier.PersonCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns classifier output into {@code category/value} tags.
 *
 * <p>Order is fixed: scene, roomtype, clothing, people. Only aspects present in the input are
 * emitted and nothing is de-duplicated. Confidence is ignored unless a floor is configured.
 */
public class TagSynthesizer {
  public static final String PEOPLE = "people";

  private final Double minConfidence;

  /** Synthesizer that never filters on confidence. */
  public TagSynthesizer() {
    this.minConfidence = null;
  }

  /**
   * @param minConfidencePercent aspects below this confidence (0-100) are dropped
   */
  public TagSynthesizer(double minConfidencePercent) {
    this.minConfidence = minConfidencePercent / 100.0;
  }

  public List<String> synthesize(ClassificationResult result, PersonCategory people) {
    List<String> tags = new ArrayList<>(Aspect.values().length + 1);
    if (result != null) {
      for (Aspect aspect : Aspect.values()) {
        Optional<LabelScore> score = result.get(aspect);
        if (score.isPresent() && passes(score.get())) {
          tags.add(aspect.key() + "/" + score.get().label());
        }
      }
    }
    if (people != null) {
      tags.add(PEOPLE + "/" + people.value());
    }
    return tags;
  }

  private boolean passes(LabelScore score) {
    return minConfidence == null || score.confidence() >= minConfidence;
  }
}
