package com.gentoro.autotag.batch;

import com.gentoro.autotag.exception.BatchException;
import com.gentoro.autotag.exception.ExceptionUtil;
import com.gentoro.autotag.image.FolderScanner;
import com.gentoro.autotag.image.ValidationResult;
import com.gentoro.autotag.tagging.ProcessingOutcome;
import com.gentoro.autotag.tagging.TaggingPipeline;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Runs folder batches on a single background worker.
 *
 * <p>Files are processed one at a time. A failure of one file is recorded and the loop moves on;
 * only an exception outside the per-file boundary ends the job in {@link BatchPhase#ERROR}.
 *
 * <p>Starting a batch resets the shared {@link JobStatus} immediately. If another batch is still
 * running, its remaining updates are dropped by the status store; it stops at its next file
 * boundary and the new batch runs once the worker is free.
 */
public final class BatchOrchestrator implements AutoCloseable {
  private static final Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(BatchOrchestrator.class);

  private final FolderScanner scanner;
  private final TaggingPipeline pipeline;
  private final JobStatus status;
  private final ExecutorService executor;

  public BatchOrchestrator(FolderScanner scanner, TaggingPipeline pipeline, JobStatus status) {
    this.scanner = scanner;
    this.pipeline = pipeline;
    this.status = status;
    this.executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "autotag-batch"));
  }

  /**
   * Starts a batch in the background.
   *
   * @return false when the worker no longer accepts jobs
   */
  public boolean start(BatchRequest request) {
    if (executor.isShutdown()) {
      log.warn("Batch worker is shut down, ignoring request for {}", request.folder());
      return false;
    }
    if (status.isActive()) {
      log.warn(
          "A batch is already running; its status will be overwritten by {}", request.folder());
    }
    long id = status.start(request);
    try {
      executor.submit(() -> run(id, request));
    } catch (RejectedExecutionException e) {
      log.error("Batch for {} rejected: {}", request.folder(), e.getMessage());
      status.setPhase(id, BatchPhase.ERROR, "Error: batch worker unavailable");
      return false;
    }
    log.info(
        "Batch queued for {} (recursive: {}, save_mode: {}, tag_mode: {})",
        request.folder(),
        request.recursive(),
        request.saveMode().value(),
        request.tagMode().value());
    return true;
  }

  public JobStatus status() {
    return status;
  }

  public boolean isActive() {
    return status.isActive();
  }

  void run(long id, BatchRequest request) {
    try {
      List<Path> files = scanner.scan(request.folder(), request.recursive());
      if (!status.finishScanning(id, files.size())) {
        superseded(id);
        return;
      }

      if (files.isEmpty()) {
        log.warn("No images found in {}", request.folder());
        status.setPhase(id, BatchPhase.COMPLETE, "No images found");
        return;
      }

      if (!status.setPhase(id, BatchPhase.PROCESSING, "Processing " + files.size() + " images")) {
        superseded(id);
        return;
      }
      for (int i = 0; i < files.size(); i++) {
        if (Thread.currentThread().isInterrupted()) {
          throw new BatchException("Batch interrupted after " + i + " files");
        }

        Path file = files.get(i);
        String name = file.getFileName().toString();
        if (!status.setCurrent(id, i, files.size(), name)) {
          superseded(id);
          return;
        }
        if (!status.recordResult(id, name, processFile(file, request))) {
          superseded(id);
          return;
        }
      }

      JobStatusSnapshot done = status.snapshot();
      String summary =
          "Completed: " + done.successfulFiles() + "/" + done.totalFiles() + " successful";
      if (status.setPhase(id, BatchPhase.COMPLETE, summary)) {
        log.info("Batch processing completed: {}", summary);
      } else {
        superseded(id);
      }
    } catch (Exception e) {
      log.error(
          "Error in batch processing of {}: {} at {}",
          request.folder(),
          e.toString(),
          ExceptionUtil.formatCompactStackTrace(e));
      status.setPhase(id, BatchPhase.ERROR, "Error: " + ExceptionUtil.describe(e));
    }
  }

  private ProcessingOutcome processFile(Path file, BatchRequest request) {
    long start = System.nanoTime();
    try {
      byte[] content = Files.readAllBytes(file);
      ValidationResult validation = pipeline.validate(content, file.getFileName().toString());
      if (!validation.valid()) {
        log.warn("Skipping invalid image {}: {}", file, validation.reason());
        return ProcessingOutcome.failed(file, validation.reason(), since(start));
      }
      ProcessingOutcome outcome = pipeline.process(file, request.tagMode(), request.saveMode());
      if (!outcome.success()) {
        log.warn("Failed to tag {}: {}", file, outcome.error());
      }
      return outcome;
    } catch (Exception e) {
      log.error("Error processing {}: {}", file, e.toString());
      return ProcessingOutcome.failed(file, ExceptionUtil.describe(e), since(start));
    }
  }

  private void superseded(long id) {
    log.info("Batch {} superseded by job {}, stopping", id, status.currentJob());
  }

  private static Duration since(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  /** Stops the worker, interrupting a running batch. */
  public void shutdown() {
    if (!executor.shutdownNow().isEmpty()) {
      status.setPhase(
          status.currentJob(), BatchPhase.ERROR, "Error: shut down before the batch started");
    }
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Batch worker did not terminate within 10s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    shutdown();
  }
}
