package com.gentoro.autotag.exception;

/**
 * Inference failures raised inside a classifier implementation. Never crosses the {@link
 * com.gentoro.autotag.classifier.Classifier} boundary.
 */
public class ClassifierException extends AutoTagException {
  public ClassifierException(String message) {
    super(AutoTagErrorCode.CLASSIFIER_ERROR, message);
  }

  public ClassifierException(String message, Throwable cause) {
    super(AutoTagErrorCode.CLASSIFIER_ERROR, message, cause);
  }
}
