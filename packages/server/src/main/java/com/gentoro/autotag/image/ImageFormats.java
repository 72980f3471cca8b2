package com.gentoro.autotag.image;

import com.gentoro.autotag.utility.FileUtility;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Image file types the service accepts, by file extension and by decoded format. */
public final class ImageFormats {

  /** Extension allow-list shared by upload validation and folder scanning. */
  public static final Set<String> EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif", "webp");

  /** javax.imageio format names, lower-cased, mapped to their canonical format. */
  private static final Map<String, String> DECODED_FORMATS =
      Map.ofEntries(
          Map.entry("jpeg", "jpeg"),
          Map.entry("jpg", "jpeg"),
          Map.entry("png", "png"),
          Map.entry("gif", "gif"),
          Map.entry("bmp", "bmp"),
          Map.entry("tif", "tiff"),
          Map.entry("tiff", "tiff"),
          Map.entry("webp", "webp"));

  private ImageFormats() {}

  public static boolean hasSupportedExtension(String fileName) {
    return EXTENSIONS.contains(FileUtility.extension(fileName));
  }

  public static boolean hasSupportedExtension(Path file) {
    Path name = file.getFileName();
    return name != null && hasSupportedExtension(name.toString());
  }

  /** Canonical format for an imageio reader format name, or {@code null} if unsupported. */
  public static String canonicalFormat(String readerFormatName) {
    if (readerFormatName == null) return null;
    return DECODED_FORMATS.get(readerFormatName.toLowerCase(Locale.ROOT));
  }
}
