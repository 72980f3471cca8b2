package com.gentoro.autotag.batch;

import com.gentoro.autotag.tagging.ProcessingOutcome;
import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Record of the current (or most recent) batch job.
 *
 * <p>Every read and write goes through one lock, held only while fields are copied or mutated.
 * Counters of a finished file are updated together in {@link #recordResult}, so a snapshot always
 * satisfies {@code processed == successful + failed}. The recent-status buffer keeps the newest
 * {@code recentCapacity} messages; the error log is unbounded.
 *
 * <p>{@link #start} hands out a job id. Updates carrying an older id are dropped, so a batch that
 * was replaced by a newer one cannot touch the newer job's record.
 */
public final class JobStatus {
  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(JobStatus.class);

  public static final int DEFAULT_RECENT_CAPACITY = 10;

  private final Object lock = new Object();
  private final int recentCapacity;
  private final Clock clock;
  private final List<Consumer<BatchPhase>> phaseListeners = new CopyOnWriteArrayList<>();

  // guarded by lock
  private long job;
  private BatchPhase phase = BatchPhase.IDLE;
  private boolean active;
  private String currentPath = "";
  private int totalFiles;
  private int processedFiles;
  private int successfulFiles;
  private int failedFiles;
  private String currentFile = "";
  private Instant startTime;
  private Instant endTime;
  private double etaSeconds;
  private SaveMode saveMode = SaveMode.REPLACE;
  private TagMode tagMode = TagMode.APPEND;
  private final Deque<StatusMessage> recent = new ArrayDeque<>();
  private final List<StatusMessage> errors = new ArrayList<>();
  private double totalSeconds;
  private int timedFiles;
  private FileTiming fastest = FileTiming.NONE;
  private FileTiming slowest = FileTiming.NONE;
  private final List<String> outputFiles = new ArrayList<>();

  public JobStatus() {
    this(DEFAULT_RECENT_CAPACITY, Clock.systemUTC());
  }

  public JobStatus(int recentCapacity, Clock clock) {
    if (recentCapacity <= 0) {
      throw new IllegalArgumentException("recentCapacity must be positive");
    }
    this.recentCapacity = recentCapacity;
    this.clock = clock;
  }

  /** Listener invoked after every phase change, outside the lock. */
  public void addPhaseListener(Consumer<BatchPhase> listener) {
    phaseListeners.add(listener);
  }

  /**
   * Resets every field for a new job and enters {@link BatchPhase#SCANNING}.
   *
   * @return id of the new job, required by every later update
   */
  public long start(BatchRequest request) {
    long id;
    synchronized (lock) {
      id = ++job;
      active = true;
      currentPath = request.folder().toString();
      totalFiles = 0;
      processedFiles = 0;
      successfulFiles = 0;
      failedFiles = 0;
      currentFile = "";
      startTime = clock.instant();
      endTime = null;
      etaSeconds = 0;
      saveMode = request.saveMode();
      tagMode = request.tagMode();
      recent.clear();
      errors.clear();
      totalSeconds = 0;
      timedFiles = 0;
      fastest = FileTiming.NONE;
      slowest = FileTiming.NONE;
      outputFiles.clear();
      phase = BatchPhase.SCANNING;
      addMessage("", "Scanning " + currentPath);
    }
    firePhase(BatchPhase.SCANNING);
    return id;
  }

  /** Id of the most recently started job, zero before the first one. */
  public long currentJob() {
    synchronized (lock) {
      return job;
    }
  }

  public boolean isCurrent(long id) {
    synchronized (lock) {
      return id == job;
    }
  }

  /**
   * Moves the job to {@code newPhase}. Terminal phases clear {@code active} and freeze the
   * runtime; any other phase marks the job active.
   *
   * @return false when {@code id} is no longer the current job and nothing changed
   */
  public boolean setPhase(long id, BatchPhase newPhase, String message) {
    synchronized (lock) {
      if (stale(id, "phase " + newPhase.value())) {
        return false;
      }
      phase = newPhase;
      if (newPhase.isTerminal()) {
        active = false;
        currentFile = "";
        etaSeconds = 0;
        endTime = clock.instant();
      } else {
        active = true;
        endTime = null;
      }
      if (message != null) {
        addMessage("", message);
      }
    }
    firePhase(newPhase);
    return true;
  }

  /** Fixes the number of files discovered by the scan. */
  public boolean finishScanning(long id, int total) {
    synchronized (lock) {
      if (stale(id, "scan result")) {
        return false;
      }
      totalFiles = total;
      return true;
    }
  }

  /**
   * @param index zero-based position of the file in the scan result
   */
  public boolean setCurrent(long id, int index, int total, String filename) {
    synchronized (lock) {
      if (stale(id, "current file " + filename)) {
        return false;
      }
      currentFile = filename;
      if (total != totalFiles) {
        log.warn("File {} reported against {} files, scan found {}", index, total, totalFiles);
      }
      return true;
    }
  }

  /** Applies the outcome of one file: counters, messages, timing, ETA and output path. */
  public boolean recordResult(long id, String file, ProcessingOutcome outcome) {
    double seconds = outcome.elapsedSeconds();
    String elapsed = String.format(Locale.ROOT, "%.2f", seconds);
    synchronized (lock) {
      if (stale(id, "result for " + file)) {
        return false;
      }
      processedFiles++;
      if (outcome.success()) {
        successfulFiles++;
        Path out = outcome.outputPath();
        if (out != null) {
          outputFiles.add(out.toString());
        }
        addMessage(file, "Tagged (" + outcome.tags().size() + " tags) in " + elapsed + "s");
      } else {
        failedFiles++;
        addMessage(file, "Failed in " + elapsed + "s: " + outcome.error());
        errors.add(new StatusMessage(epochSeconds(clock.instant()), file, outcome.error()));
      }
      addTiming(file, seconds);
      int remaining = Math.max(0, totalFiles - processedFiles);
      etaSeconds = averageSeconds() * remaining;
      return true;
    }
  }

  public boolean isActive() {
    synchronized (lock) {
      return active;
    }
  }

  public BatchPhase phase() {
    synchronized (lock) {
      return phase;
    }
  }

  public JobStatusSnapshot snapshot() {
    synchronized (lock) {
      Instant now = clock.instant();
      double runtime = 0;
      if (startTime != null) {
        Instant until = endTime != null ? endTime : now;
        runtime = Math.max(0, (until.toEpochMilli() - startTime.toEpochMilli()) / 1000.0);
      }
      double progress =
          totalFiles > 0 ? Math.round(processedFiles * 1000.0 / totalFiles) / 10.0 : 0.0;
      return new JobStatusSnapshot(
          active,
          currentPath,
          phase,
          totalFiles,
          processedFiles,
          successfulFiles,
          failedFiles,
          progress,
          currentFile,
          startTime == null ? 0 : epochSeconds(startTime),
          endTime == null ? null : epochSeconds(endTime),
          etaSeconds,
          formatDuration(etaSeconds),
          formatDuration(runtime),
          saveMode,
          tagMode,
          new ArrayList<>(recent),
          new ArrayList<>(errors),
          new JobStatusSnapshot.Stats(averageSeconds(), fastest, slowest),
          new ArrayList<>(outputFiles));
    }
  }

  /** Formats seconds as {@code 45s}, {@code 2m 0s} or {@code 1h 2m 5s}. */
  public static String formatDuration(double seconds) {
    long total = (long) Math.max(0, seconds);
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    if (hours > 0) {
      return "%dh %dm %ds".formatted(hours, minutes, secs);
    }
    if (minutes > 0) {
      return "%dm %ds".formatted(minutes, secs);
    }
    return secs + "s";
  }

  private boolean stale(long id, String update) {
    if (id == job) {
      return false;
    }
    log.debug("Dropping {} from job {}, current job is {}", update, id, job);
    return true;
  }

  private void addMessage(String file, String text) {
    if (recent.size() == recentCapacity) {
      recent.removeFirst();
    }
    recent.addLast(new StatusMessage(epochSeconds(clock.instant()), file, text));
  }

  private void addTiming(String file, double seconds) {
    totalSeconds += seconds;
    timedFiles++;
    if (fastest == FileTiming.NONE || seconds < fastest.time()) {
      fastest = new FileTiming(file, seconds);
    }
    if (slowest == FileTiming.NONE || seconds > slowest.time()) {
      slowest = new FileTiming(file, seconds);
    }
  }

  private double averageSeconds() {
    return timedFiles == 0 ? 0 : totalSeconds / timedFiles;
  }

  private void firePhase(BatchPhase p) {
    for (Consumer<BatchPhase> listener : phaseListeners) {
      listener.accept(p);
    }
  }

  private static double epochSeconds(Instant instant) {
    return instant.toEpochMilli() / 1000.0;
  }
}
