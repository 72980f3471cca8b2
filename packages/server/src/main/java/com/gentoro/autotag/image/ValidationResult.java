package com.gentoro.autotag.image;

/** Outcome of {@link ImageValidator#validate}. {@code reason} is null when valid. */
public record ValidationResult(boolean valid, String reason) {

  public static ValidationResult ok() {
    return new ValidationResult(true, null);
  }

  public static ValidationResult invalid(String reason) {
    return new ValidationResult(false, reason);
  }
}
