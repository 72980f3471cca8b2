package com.gentoro.autotag.metadata;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command bounded by a timeout.
 *
 * <p>When the timeout expires the whole process tree is destroyed and reaped before {@link #run}
 * returns, so no child outlives the call. Output is drained on a separate thread to keep the
 * child from blocking on a full pipe.
 */
public class CommandRunner {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(CommandRunner.class);

  static final int MAX_OUTPUT_BYTES = 16 * 1024;
  private static final long REAP_TIMEOUT_SECONDS = 5;

  /**
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting; the process
   *     tree is destroyed first
   */
  public CommandResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Process process = pb.start();

    OutputCollector collector = new OutputCollector(process.getInputStream());
    Thread drainer = new Thread(collector, "command-output-" + process.pid());
    drainer.setDaemon(true);
    drainer.start();

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      destroyTree(process);
      throw e;
    }

    if (!finished) {
      log.warn(
          "Command {} exceeded {}ms, destroying process tree", command.get(0), timeout.toMillis());
      destroyTree(process);
      drainer.join(TimeUnit.SECONDS.toMillis(1));
      return new CommandResult(-1, collector.text(), true);
    }

    drainer.join(TimeUnit.SECONDS.toMillis(REAP_TIMEOUT_SECONDS));
    return new CommandResult(process.exitValue(), collector.text(), false);
  }

  private static void destroyTree(Process process) throws InterruptedException {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    if (!process.waitFor(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
      log.error("Process {} did not terminate after being killed", process.pid());
    }
  }

  private static final class OutputCollector implements Runnable {
    private final InputStream in;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    OutputCollector(InputStream in) {
      this.in = in;
    }

    @Override
    public void run() {
      byte[] chunk = new byte[4096];
      try (in) {
        int n;
        while ((n = in.read(chunk)) != -1) {
          synchronized (buffer) {
            int room = MAX_OUTPUT_BYTES - buffer.size();
            if (room > 0) buffer.write(chunk, 0, Math.min(n, room));
          }
        }
      } catch (IOException e) {
        log.debug("Command output stream closed: {}", e.getMessage());
      }
    }

    String text() {
      synchronized (buffer) {
        return buffer.toString(StandardCharsets.UTF_8).trim();
      }
    }
  }
}
