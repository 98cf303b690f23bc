package dev.zzpscanner.api;

import dev.zzpscanner.maintenance.CleanupResult;
import dev.zzpscanner.maintenance.MaintenanceService;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/maintenance")
public class MaintenanceController {

  private final MaintenanceService maintenanceService;

  public MaintenanceController(MaintenanceService maintenanceService) {
    this.maintenanceService = maintenanceService;
  }

  @PostMapping("/deduplicate")
  public Removed deduplicate() {
    return new Removed(maintenanceService.deduplicate());
  }

  @PostMapping("/recalculate-confidence")
  public Updated recalculateConfidence() {
    return new Updated(maintenanceService.recalculateConfidenceScores());
  }

  @PostMapping("/cleanup")
  public CleanupResult cleanup(
      @RequestParam(name = "days", required = false) @Nullable Integer days) {
    return maintenanceService.cleanup(days);
  }

  record Removed(int removed) {}

  record Updated(int updated) {}
}
