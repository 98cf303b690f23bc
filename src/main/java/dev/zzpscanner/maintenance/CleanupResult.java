package dev.zzpscanner.maintenance;

import java.time.Instant;

/** Rows removed by one cleanup run. */
public record CleanupResult(
    Instant cutoff, int deletedChecks, int deletedJobs, int deletedBusinesses) {}
