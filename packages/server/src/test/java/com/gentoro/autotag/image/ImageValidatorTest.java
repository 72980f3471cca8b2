package com.gentoro.autotag.image;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autotag.TestImages;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ImageValidatorTest {

  private final ImageValidator validator = new ImageValidator();

  @Test
  void acceptsPngAndJpeg() {
    assertTrue(validator.validate(TestImages.png(), "a.png").valid());
    assertTrue(validator.validate(TestImages.jpeg(), "b.JPG").valid());
    assertTrue(validator.validate(TestImages.jpeg(), "c.jpeg").valid());
  }

  @Test
  void acceptsBmp() {
    assertTrue(validator.validate(TestImages.encode("bmp"), "x.bmp").valid());
  }

  @Test
  @DisplayName("Unsupported extension fails without looking at the bytes")
  void rejectsUnsupportedExtension() {
    ValidationResult result = validator.validate(TestImages.png(), "notes.txt");
    assertFalse(result.valid());
    assertTrue(result.reason().contains("'.txt'"), result.reason());
  }

  @Test
  void rejectsMissingExtension() {
    ValidationResult result = validator.validate(TestImages.png(), "README");
    assertFalse(result.valid());
    assertTrue(result.reason().contains("extension"), result.reason());
  }

  @Test
  void rejectsMissingFilenameAndEmptyContent() {
    assertFalse(validator.validate(TestImages.png(), null).valid());
    assertFalse(validator.validate(TestImages.png(), " ").valid());
    assertFalse(validator.validate(new byte[0], "a.png").valid());
    assertFalse(validator.validate(null, "a.png").valid());
  }

  @Test
  void acceptsSupportedContentUnderAnotherExtension() {
    // extension only gates the decode; any supported format decodes
    assertTrue(validator.validate(TestImages.jpeg(), "mislabeled.png").valid());
  }

  @Test
  void rejectsGarbageBytes() {
    byte[] garbage = "definitely not an image".getBytes(StandardCharsets.UTF_8);
    ValidationResult result = validator.validate(garbage, "c.png");
    assertFalse(result.valid());
    assertTrue(result.reason().startsWith("Invalid image"), result.reason());
  }

  @Test
  @DisplayName("Truncated data is caught by the full decode")
  void rejectsTruncatedImage() {
    ValidationResult result = validator.validate(TestImages.truncatedPng(), "cut.png");
    assertFalse(result.valid());
    assertNotNull(result.reason());
  }

  @Test
  void okHasNoReason() {
    ValidationResult ok = ValidationResult.ok();
    assertTrue(ok.valid());
    assertNull(ok.reason());
  }
}
