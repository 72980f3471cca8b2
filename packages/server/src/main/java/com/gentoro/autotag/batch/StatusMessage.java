package com.gentoro.autotag.batch;

/**
 * One entry of the recent-status ring buffer or the error log.
 *
 * @param time epoch seconds
 * @param file base name of the file, empty for job-level messages
 */
public record StatusMessage(double time, String file, String message) {}
