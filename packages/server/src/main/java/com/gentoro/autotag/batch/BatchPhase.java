package com.gentoro.autotag.batch;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse lifecycle state of the batch job. */
public enum BatchPhase {
  IDLE,
  SCANNING,
  PROCESSING,
  COMPLETE,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
