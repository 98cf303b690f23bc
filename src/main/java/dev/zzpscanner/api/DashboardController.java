package dev.zzpscanner.api;

import dev.zzpscanner.business.LabelCount;
import dev.zzpscanner.dashboard.CheckSuccessRate;
import dev.zzpscanner.dashboard.DailyReport;
import dev.zzpscanner.dashboard.DashboardService;
import dev.zzpscanner.dashboard.DashboardStats;
import dev.zzpscanner.dashboard.JobPerformance;
import java.time.LocalDate;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/dashboard")
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @GetMapping("/stats")
  public DashboardStats stats() {
    return dashboardService.stats();
  }

  @GetMapping("/top-cities")
  public List<LabelTotal> topCities(@RequestParam(name = "limit", defaultValue = "10") int limit) {
    return dashboardService.topCities(limit).stream().map(LabelTotal::from).toList();
  }

  @GetMapping("/top-industries")
  public List<LabelTotal> topIndustries(
      @RequestParam(name = "limit", defaultValue = "10") int limit) {
    return dashboardService.topIndustries(limit).stream().map(LabelTotal::from).toList();
  }

  @GetMapping("/website-check-success-rate")
  public CheckSuccessRate websiteCheckSuccessRate(
      @RequestParam(name = "days", defaultValue = "7") int days) {
    return dashboardService.websiteCheckSuccessRate(days);
  }

  @GetMapping("/daily-report")
  public DailyReport dailyReport(
      @RequestParam(name = "date", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          @Nullable LocalDate date) {
    return dashboardService.dailyReport(date);
  }

  @GetMapping("/job-performance")
  public List<JobPerformance> jobPerformance() {
    return dashboardService.jobPerformance();
  }

  @GetMapping("/recent-activity")
  public RecentActivity recentActivity(
      @RequestParam(name = "limit", defaultValue = "10") int limit) {
    return new RecentActivity(
        dashboardService.recentJobs(limit).stream().map(JobResponse::from).toList(),
        dashboardService.recentChecks(limit).stream().map(WebsiteCheckResponse::from).toList());
  }

  record LabelTotal(String label, long total) {
    static LabelTotal from(LabelCount count) {
      return new LabelTotal(count.getLabel(), count.getTotal());
    }
  }

  record RecentActivity(List<JobResponse> recentJobs, List<WebsiteCheckResponse> recentChecks) {}
}
