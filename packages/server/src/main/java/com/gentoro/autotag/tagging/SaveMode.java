package com.gentoro.autotag.tagging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.autotag.exception.ValidationException;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/** Whether tagging mutates the original file or a {@code _tagged} sibling copy. */
public enum SaveMode {
  REPLACE,
  SUFFIX;

  public static final String SUFFIX_MARKER = "_tagged";

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SaveMode parse(String value) {
    String normalized = StringUtils.trimToNull(value);
    if (normalized == null) {
      throw new ValidationException("Missing save mode");
    }
    for (SaveMode mode : values()) {
      if (mode.value().equalsIgnoreCase(normalized)) return mode;
    }
    throw new ValidationException(
        "Invalid save_mode '" + value + "', expected 'replace' or 'suffix'");
  }
}
