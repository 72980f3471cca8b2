package com.gentoro.autotag.classifier;

import java.nio.file.Path;

/**
 * Opaque image classification capability.
 *
 * <p>Implementations are constructed once at startup and shared; callers invoke them from one
 * thread at a time. Neither method throws: on any internal failure {@link #analyze} returns an
 * empty or partial result and {@link #countPeople} returns {@link PersonCategory#NONE}.
 */
public interface Classifier extends AutoCloseable {

  /** Scene, room type and clothing labels with confidence. */
  ClassificationResult analyze(Path image);

  /** Person-count category. */
  PersonCategory countPeople(Path image);

  /** Short name for logs and health output. */
  String name();

  @Override
  default void close() {}
}
