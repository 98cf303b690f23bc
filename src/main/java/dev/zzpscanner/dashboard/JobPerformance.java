package dev.zzpscanner.dashboard;

import org.jspecify.annotations.Nullable;

/**
 * Outcome summary of one job kind.
 *
 * @param averageDurationSeconds mean start-to-completion time of completed jobs, null if none
 */
public record JobPerformance(
    String kind,
    long total,
    long completed,
    long failed,
    long cancelled,
    double successRate,
    @Nullable Double averageDurationSeconds) {}
