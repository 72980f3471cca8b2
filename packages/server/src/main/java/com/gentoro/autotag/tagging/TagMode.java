package com.gentoro.autotag.tagging;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.autotag.exception.ValidationException;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/** How new tags combine with tags already stored in the file. */
public enum TagMode {
  /** Add to the existing list. */
  APPEND,
  /** Replace the existing list. */
  OVERWRITE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TagMode parse(String value) {
    String normalized = StringUtils.trimToNull(value);
    if (normalized == null) {
      throw new ValidationException("Missing tag mode");
    }
    for (TagMode mode : values()) {
      if (mode.value().equalsIgnoreCase(normalized)) return mode;
    }
    throw new ValidationException(
        "Invalid tag_mode '" + value + "', expected 'append' or 'overwrite'");
  }
}
