package com.gentoro.autotag.exception;

/** Orchestrator-level failure that ends a batch in the error phase. */
public class BatchException extends AutoTagException {
  public BatchException(String message) {
    super(AutoTagErrorCode.BATCH_ERROR, message);
  }

  public BatchException(String message, Throwable cause) {
    super(AutoTagErrorCode.BATCH_ERROR, message, cause);
  }
}
