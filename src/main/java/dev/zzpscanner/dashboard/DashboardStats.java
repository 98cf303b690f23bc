package dev.zzpscanner.dashboard;

import java.util.Map;

/**
 * Headline numbers for the dashboard.
 *
 * @param jobsByStatus job count per lifecycle status value
 * @param checksLast24h website checks created in the last 24 hours
 */
public record DashboardStats(
    long totalBusinesses,
    long zzpBusinesses,
    long withWebsite,
    long withoutWebsite,
    long processedBusinesses,
    long businessesAddedLast24h,
    Map<String, Long> jobsByStatus,
    long checksLast24h) {}
