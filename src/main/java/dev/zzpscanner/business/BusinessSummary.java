package dev.zzpscanner.business;

import java.util.Map;

/** Catalog-wide business counts, broken down by country and by discovery source. */
public record BusinessSummary(
    long totalBusinesses,
    long zzpBusinesses,
    long withWebsite,
    long withoutWebsite,
    double websitePercentage,
    Map<String, Long> byCountry,
    Map<String, Long> bySource) {}
