package com.gentoro.autotag.metadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

/**
 * Shell script standing in for ExifTool. It records its arguments one per line in {@code
 * args.log} and appends the tag assignment to the target file so content changes are visible.
 */
final class FakeExifTool {
  final Path script;
  final Path argsLog;

  private FakeExifTool(Path script, Path argsLog) {
    this.script = script;
    this.argsLog = argsLog;
  }

  static FakeExifTool succeeding(Path dir) throws IOException {
    return create(dir, "printf '\\n%s' \"$1\" >> \"$3\"\nexit 0\n");
  }

  static FakeExifTool failing(Path dir, int exitCode) throws IOException {
    return create(dir, "echo 'Error: file format not supported' >&2\nexit " + exitCode + "\n");
  }

  static FakeExifTool sleeping(Path dir, int seconds) throws IOException {
    return create(dir, "sleep " + seconds + "\nprintf '\\n%s' \"$1\" >> \"$3\"\n");
  }

  private static FakeExifTool create(Path dir, String body) throws IOException {
    Path argsLog = dir.resolve("args.log");
    Path script = dir.resolve("fake-exiftool.sh");
    String content =
        "#!/bin/sh\nfor a in \"$@\"; do printf '%s\\n' \"$a\" >> '" + argsLog + "'; done\n" + body;
    Files.writeString(script, content);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
    return new FakeExifTool(script, argsLog);
  }

  boolean invoked() {
    return Files.exists(argsLog);
  }

  List<String> arguments() throws IOException {
    return Files.readAllLines(argsLog);
  }
}
