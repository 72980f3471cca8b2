package com.gentoro.autotag.classifier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Labels produced for one image, keyed by {@link Aspect}. Any subset of aspects may be absent; an
 * empty result is the degraded outcome of a failed classification.
 */
public final class ClassificationResult {
  private static final ClassificationResult EMPTY = new ClassificationResult(Map.of());

  private final Map<Aspect, LabelScore> labels;

  private ClassificationResult(Map<Aspect, LabelScore> labels) {
    EnumMap<Aspect, LabelScore> copy = new EnumMap<>(Aspect.class);
    copy.putAll(labels);
    this.labels = Collections.unmodifiableMap(copy);
  }

  public static ClassificationResult empty() {
    return EMPTY;
  }

  public static ClassificationResult of(Map<Aspect, LabelScore> labels) {
    return labels.isEmpty() ? EMPTY : new ClassificationResult(labels);
  }

  public Optional<LabelScore> get(Aspect aspect) {
    return Optional.ofNullable(labels.get(aspect));
  }

  public Map<Aspect, LabelScore> asMap() {
    return labels;
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ClassificationResult other && labels.equals(other.labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return "ClassificationResult" + labels;
  }
}
