package com.gentoro.autotag.exception;

/** Rejected client input: unknown modes, missing fields, unreadable request bodies. */
public class ValidationException extends AutoTagException {
  public ValidationException(String message) {
    super(AutoTagErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AutoTagErrorCode.VALIDATION_ERROR, message, cause);
  }
}
