package dev.zzpscanner.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the retention cleanup on a cron schedule (Sunday 03:00 UTC unless
 * {@code scanner.maintenance.cleanup-cron} says otherwise).
 *
 * <p>Disabled with {@code scanner.maintenance.scheduled-cleanup=false}.
 */
@Component
@ConditionalOnProperty(
    prefix = "scanner.maintenance",
    name = "scheduled-cleanup",
    havingValue = "true",
    matchIfMissing = true)
public class MaintenanceScheduler {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

  private final MaintenanceService maintenanceService;

  public MaintenanceScheduler(MaintenanceService maintenanceService) {
    this.maintenanceService = maintenanceService;
  }

  @Scheduled(cron = "${scanner.maintenance.cleanup-cron:0 0 3 * * SUN}", zone = "UTC")
  public void scheduledCleanup() {
    log.info("Starting scheduled cleanup");
    try {
      CleanupResult result = maintenanceService.cleanup(null);
      log.info("Scheduled cleanup finished: {}", result);
    } catch (RuntimeException e) {
      log.error("Scheduled cleanup failed: {}", e.getMessage(), e);
    }
  }
}
