package com.gentoro.autotag.metadata;

/**
 * Outcome of a child process run by {@link CommandRunner}.
 *
 * @param exitCode process exit code, {@code -1} when the process was killed on timeout
 * @param output combined stdout and stderr, truncated to a bounded size
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

  public boolean succeeded() {
    return !timedOut && exitCode == 0;
  }
}
