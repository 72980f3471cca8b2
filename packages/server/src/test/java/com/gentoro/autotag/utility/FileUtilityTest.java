package com.gentoro.autotag.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilityTest {

  @Test
  void extension() {
    assertEquals("jpg", FileUtility.extension("photo.JPG"));
    assertEquals("gz", FileUtility.extension("archive.tar.gz"));
    assertEquals("", FileUtility.extension("README"));
    assertEquals("", FileUtility.extension(".hidden"));
    assertEquals("", FileUtility.extension("trailing."));
    assertEquals("", FileUtility.extension("dir.d/file"));
    assertEquals("", FileUtility.extension(null));
  }

  @Test
  void withSuffix() {
    assertEquals(
        Path.of("/a/b_tagged.jpg"), FileUtility.withSuffix(Path.of("/a/b.jpg"), "_tagged"));
    assertEquals(
        Path.of("/a/b.c_tagged.png"), FileUtility.withSuffix(Path.of("/a/b.c.png"), "_tagged"));
    assertEquals(
        Path.of("/a/noext_tagged"), FileUtility.withSuffix(Path.of("/a/noext"), "_tagged"));
  }

  @Test
  void copyStreamCreatesParents(@TempDir Path dir) throws Exception {
    Path dest = dir.resolve("x/y/out.bin");
    FileUtility.copyStream(
        new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)), dest);
    assertEquals("hello", Files.readString(dest));
  }

  @Test
  void deleteQuietly(@TempDir Path dir) throws Exception {
    Path file = Files.writeString(dir.resolve("f.txt"), "x");
    assertTrue(FileUtility.deleteQuietly(file));
    assertFalse(FileUtility.deleteQuietly(file));
    assertFalse(FileUtility.deleteQuietly(null));

    Path nonEmpty = Files.createDirectories(dir.resolve("d"));
    Files.writeString(nonEmpty.resolve("inner"), "x");
    assertFalse(FileUtility.deleteQuietly(nonEmpty));
    assertTrue(Files.exists(nonEmpty));
  }
}
