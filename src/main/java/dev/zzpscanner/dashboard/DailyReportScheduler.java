package dev.zzpscanner.dashboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Logs yesterday's {@link DailyReport} shortly after midnight UTC. */
@Component
@ConditionalOnProperty(
    prefix = "scanner.dashboard",
    name = "daily-report-log",
    havingValue = "true",
    matchIfMissing = true)
public class DailyReportScheduler {

  private static final Logger log = LoggerFactory.getLogger(DailyReportScheduler.class);

  private final DashboardService dashboardService;

  public DailyReportScheduler(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @Scheduled(cron = "${scanner.dashboard.daily-report-cron:0 5 0 * * *}", zone = "UTC")
  public void logDailyReport() {
    try {
      log.info("Daily report: {}", dashboardService.dailyReport(null));
    } catch (RuntimeException e) {
      log.error("Daily report failed: {}", e.getMessage(), e);
    }
  }
}
