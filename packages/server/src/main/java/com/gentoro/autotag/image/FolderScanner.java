package com.gentoro.autotag.image;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates image files under a folder, filtered by {@link ImageFormats#EXTENSIONS}.
 *
 * <p>Results are absolute paths in file-system traversal order. They are not sorted, so callers
 * must not rely on a particular order.
 */
public class FolderScanner {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(FolderScanner.class);

  /**
   * @throws IOException if {@code folder} is not a readable directory
   */
  public List<Path> scan(Path folder, boolean recursive) throws IOException {
    if (!Files.isDirectory(folder)) {
      throw new IOException("Not a directory: " + folder);
    }
    Path root = folder.toAbsolutePath();
    List<Path> images = new ArrayList<>();

    if (!recursive) {
      try (Stream<Path> entries = Files.list(root)) {
        entries
            .filter(Files::isRegularFile)
            .filter(ImageFormats::hasSupportedExtension)
            .forEach(images::add);
      }
      return images;
    }

    Files.walkFileTree(
        root,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && ImageFormats.hasSupportedExtension(file)) {
              images.add(file);
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
          }
        });
    return images;
  }
}
