package com.gentoro.autotag.exception;

/** Stable error codes attached to every {@link AutoTagException}. */
public enum AutoTagErrorCode {
  CONFIG_ERROR,
  NETWORK_ERROR,
  STATE_ERROR,
  VALIDATION_ERROR,
  CLASSIFIER_ERROR,
  WRITE_ERROR,
  BATCH_ERROR
}
