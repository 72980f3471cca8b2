package com.gentoro.autotag.utility;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Small collection of file name and I/O helpers. */
public final class FileUtility {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(FileUtility.class);

  private FileUtility() {}

  /** Lower-case extension without the dot, or an empty string when there is none. */
  public static String extension(String fileName) {
    if (fileName == null) return "";
    int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
    int dot = fileName.lastIndexOf('.');
    if (dot <= slash + 1 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * Sibling of {@code file} with {@code suffix} inserted before the extension: {@code
   * /a/b.jpg + _tagged -> /a/b_tagged.jpg}.
   */
  public static Path withSuffix(Path file, String suffix) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String ext = dot > 0 ? name.substring(dot) : "";
    return file.resolveSibling(stem + suffix + ext);
  }

  /** Copy an InputStream to a file path, creating parent directories. */
  public static void copyStream(InputStream in, Path dest) throws IOException {
    Path parent = dest.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
    try (OutputStream out = Files.newOutputStream(dest)) {
      in.transferTo(out);
    }
  }

  /** Delete a file if present; failures are logged and reported as {@code false}. */
  public static boolean deleteQuietly(Path file) {
    if (file == null) return false;
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", file, e.getMessage());
      return false;
    }
  }
}
