package dev.zzpscanner.dashboard;

import java.time.LocalDate;

/**
 * Activity over one UTC calendar day plus catalog totals at the time the report was built.
 *
 * @param completedJobs jobs that completed during the day
 * @param failedJobs jobs that failed during the day
 * @param zzpWithoutWebsite self-employed businesses checked to have no website
 */
public record DailyReport(
    LocalDate date,
    long newBusinesses,
    long newWebsiteChecks,
    long completedJobs,
    long failedJobs,
    long totalBusinesses,
    long zzpWithoutWebsite) {}
