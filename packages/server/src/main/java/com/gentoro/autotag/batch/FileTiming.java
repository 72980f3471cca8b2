package com.gentoro.autotag.batch;

/** Processing time in seconds of a single file. */
public record FileTiming(String file, double time) {

  static final FileTiming NONE = new FileTiming("", 0);
}
