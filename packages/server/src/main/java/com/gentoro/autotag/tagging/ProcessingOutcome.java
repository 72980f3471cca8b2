package com.gentoro.autotag.tagging;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Result of tagging one image.
 *
 * @param outputPath file that now carries the tags; the original path when the write failed
 * @param error reason for failure, null on success
 */
public record ProcessingOutcome(
    boolean success, List<String> tags, Path outputPath, String error, Duration elapsed) {

  public ProcessingOutcome {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static ProcessingOutcome failed(Path original, String error, Duration elapsed) {
    return new ProcessingOutcome(false, List.of(), original, error, elapsed);
  }

  public double elapsedSeconds() {
    return elapsed.toNanos() / 1_000_000_000.0;
  }
}
