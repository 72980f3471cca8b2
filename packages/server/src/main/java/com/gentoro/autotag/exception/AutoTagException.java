package com.gentoro.autotag.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the AUTO-TAG exception hierarchy.
 *
 * <p>Every subclass is unchecked and carries an {@link AutoTagErrorCode} plus an optional context
 * map, so callers can log or serialize failures without inspecting concrete types.
 */
public class AutoTagException extends RuntimeException {
  private final AutoTagErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public AutoTagException(AutoTagErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public AutoTagException(AutoTagErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public AutoTagErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return {@code this} for chaining. */
  public AutoTagException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
