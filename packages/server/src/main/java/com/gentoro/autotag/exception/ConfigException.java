package com.gentoro.autotag.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends AutoTagException {
  public ConfigException(String message) {
    super(AutoTagErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AutoTagErrorCode.CONFIG_ERROR, message, cause);
  }
}
