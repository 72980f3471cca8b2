package com.gentoro.autotag.classifier;

import java.util.Locale;

/** Coarse person count: nobody, one person, or several. */
public enum PersonCategory {
  NONE,
  SOLO,
  GROUP;

  public static PersonCategory fromCount(int count) {
    if (count <= 0) return NONE;
    return count == 1 ? SOLO : GROUP;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
