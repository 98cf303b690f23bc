package dev.zzpscanner.dashboard;

/**
 * Website-check outcomes over a window.
 *
 * @param successful checks that finished without a probe error
 * @param found checks that found a website
 * @param successRate successful / total as a percentage, 0 when there were no checks
 */
public record CheckSuccessRate(
    int days, long total, long successful, long found, double successRate) {}
