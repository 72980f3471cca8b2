package com.gentoro.autotag.exception;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/** Helpers for turning throwables into log and status text. */
public final class ExceptionUtil {
  static final int DEFAULT_FRAMES = 10;

  private ExceptionUtil() {}

  /**
   * Single-line summary of the top stack frames, for example {@code
   * com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   *
   * @param maxFrames frames to keep; zero or less keeps all of them
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null || t.getStackTrace() == null) {
      return "";
    }
    StackTraceElement[] frames = t.getStackTrace();
    long limit = maxFrames <= 0 ? frames.length : maxFrames;
    return Arrays.stream(frames)
        .limit(limit)
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" > "));
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_FRAMES);
  }

  private static String frame(StackTraceElement e) {
    String location = e.getFileName() == null ? "Unknown Source" : e.getFileName();
    if (e.getLineNumber() >= 0) {
      location += ":" + e.getLineNumber();
    }
    return e.getClassName() + "." + e.getMethodName() + " (" + location + ")";
  }

  /**
   * Message used in status records and HTTP bodies: the throwable's message, or its simple class
   * name when the message is blank.
   */
  public static String describe(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    return StringUtils.defaultIfBlank(t.getMessage(), t.getClass().getSimpleName());
  }

  /** Passes an {@link AutoTagException} through unchanged and wraps anything else. */
  public static AutoTagException rethrowIfUnchecked(
      Throwable t, Function<Throwable, AutoTagException> wrapper) {
    if (t instanceof AutoTagException autoTag) {
      return autoTag;
    }
    return wrapper.apply(t);
  }
}
