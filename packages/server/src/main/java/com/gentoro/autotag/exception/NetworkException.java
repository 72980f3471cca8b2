package com.gentoro.autotag.exception;

/** Failures while binding or serving network listeners. */
public class NetworkException extends AutoTagException {
  public NetworkException(String message) {
    super(AutoTagErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(AutoTagErrorCode.NETWORK_ERROR, message, cause);
  }
}
