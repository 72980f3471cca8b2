package com.gentoro.autotag.classifier;

/** Winning label for one aspect and its probability in {@code [0, 1]}. */
public record LabelScore(String label, double confidence) {}
