package com.gentoro.autotag.metadata;

import java.nio.file.Path;

/**
 * Outcome of {@link MetadataWriter#write}.
 *
 * @param path file carrying the tags on success; the original input path on failure
 * @param error failure reason, null on success
 */
public record WriteResult(boolean success, Path path, String error) {

  public static WriteResult success(Path path) {
    return new WriteResult(true, path, null);
  }

  public static WriteResult failure(Path original, String error) {
    return new WriteResult(false, original, error);
  }
}
