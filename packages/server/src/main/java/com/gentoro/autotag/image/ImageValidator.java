package com.gentoro.autotag.image;

import com.gentoro.autotag.utility.FileUtility;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.event.IIOReadWarningListener;
import javax.imageio.stream.ImageInputStream;

/**
 * Confirms that uploaded bytes are a decodable image in a supported format.
 *
 * <p>The extension is checked first and an unsupported one fails without decoding. Otherwise the
 * first image is fully decoded, so truncated or corrupt payloads are caught; decoder warnings are
 * treated as failures for the same reason. This class never throws: every problem becomes a
 * {@link ValidationResult} with a human-readable reason.
 */
public class ImageValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(ImageValidator.class);

  public ValidationResult validate(byte[] content, String filename) {
    if (filename == null || filename.isBlank()) {
      return ValidationResult.invalid("Missing filename");
    }
    String extension = FileUtility.extension(filename);
    if (extension.isEmpty()) {
      return ValidationResult.invalid("Missing file extension: " + filename);
    }
    if (!ImageFormats.EXTENSIONS.contains(extension)) {
      return ValidationResult.invalid(
          "Unsupported file extension '." + extension + "'. Supported: " + supportedList());
    }
    if (content == null || content.length == 0) {
      return ValidationResult.invalid("Empty file: " + filename);
    }

    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
      if (in == null) {
        return ValidationResult.invalid("Unable to open image stream");
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        return ValidationResult.invalid("Invalid image: unrecognized image data in " + filename);
      }
      ImageReader reader = readers.next();
      try {
        String format = ImageFormats.canonicalFormat(reader.getFormatName());
        if (format == null) {
          return ValidationResult.invalid(
              "Unsupported image format '" + reader.getFormatName() + "'");
        }
        List<String> warnings = new ArrayList<>();
        reader.addIIOReadWarningListener(collect(warnings));
        reader.setInput(in, true, true);
        reader.read(0);
        if (!warnings.isEmpty()) {
          return ValidationResult.invalid("Invalid image: " + warnings.get(0));
        }
        return ValidationResult.ok();
      } finally {
        reader.dispose();
      }
    } catch (Exception e) {
      log.debug("Decoding {} failed", filename, e);
      String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      return ValidationResult.invalid("Invalid image: " + message);
    }
  }

  private static IIOReadWarningListener collect(List<String> warnings) {
    return (source, warning) -> warnings.add(warning);
  }

  private static String supportedList() {
    return String.join(", ", ImageFormats.EXTENSIONS.stream().sorted().toList());
  }
}
