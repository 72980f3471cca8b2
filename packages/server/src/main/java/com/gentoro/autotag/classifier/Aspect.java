package com.gentoro.autotag.classifier;

import java.util.Locale;

/** Image aspects labeled by the scene classifier, in tag order. */
public enum Aspect {
  SCENE,
  ROOMTYPE,
  CLOTHING;

  /** Key used in tags ({@code scene/indoor}) and in classifier payloads. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
