package com.gentoro.autotag.batch;

import com.gentoro.autotag.tagging.SaveMode;
import com.gentoro.autotag.tagging.TagMode;
import java.util.List;

/**
 * Immutable copy of {@link JobStatus}, serialized as-is by the status endpoint.
 *
 * <p>Times are epoch seconds. {@code etaFormatted} and {@code runtimeFormatted} are derived when
 * the snapshot is taken.
 */
public record JobStatusSnapshot(
    boolean active,
    String currentPath,
    BatchPhase phase,
    int totalFiles,
    int processedFiles,
    int successfulFiles,
    int failedFiles,
    double progressPercent,
    String currentFile,
    double startTime,
    Double endTime,
    double etaSeconds,
    String etaFormatted,
    String runtimeFormatted,
    SaveMode saveMode,
    TagMode tagMode,
    List<StatusMessage> recentStatus,
    List<StatusMessage> errors,
    Stats stats,
    List<String> outputFiles) {

  public JobStatusSnapshot {
    recentStatus = List.copyOf(recentStatus);
    errors = List.copyOf(errors);
    outputFiles = List.copyOf(outputFiles);
  }

  /** Per-file timing aggregates. */
  public record Stats(double avgTimePerImage, FileTiming fastestImage, FileTiming slowestImage) {}
}
