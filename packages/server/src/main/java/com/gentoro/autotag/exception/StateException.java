package com.gentoro.autotag.exception;

/** A component was used before it was initialized, or after shutdown. */
public class StateException extends AutoTagException {
  public StateException(String message) {
    super(AutoTagErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(AutoTagErrorCode.STATE_ERROR, message, cause);
  }
}
