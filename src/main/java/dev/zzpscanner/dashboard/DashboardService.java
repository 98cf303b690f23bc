package dev.zzpscanner.dashboard;

import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.business.LabelCount;
import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobRepository;
import dev.zzpscanner.job.JobStatus;
import dev.zzpscanner.job.KindStatusCount;
import dev.zzpscanner.website.WebsiteCheck;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read-only aggregates over businesses, jobs and website checks. */
@Service
@Transactional(readOnly = true)
public class DashboardService {

  private final BusinessRepository businessRepository;
  private final JobRepository jobRepository;
  private final WebsiteCheckRepository websiteCheckRepository;
  private final Clock clock;

  public DashboardService(
      BusinessRepository businessRepository,
      JobRepository jobRepository,
      WebsiteCheckRepository websiteCheckRepository,
      Clock clock) {
    this.businessRepository = businessRepository;
    this.jobRepository = jobRepository;
    this.websiteCheckRepository = websiteCheckRepository;
    this.clock = clock;
  }

  public DashboardStats stats() {
    Instant dayAgo = clock.instant().minus(Duration.ofDays(1));
    Map<String, Long> jobsByStatus = new LinkedHashMap<>();
    for (JobStatus status : JobStatus.values()) {
      jobsByStatus.put(status.value(), jobRepository.countByStatus(status));
    }
    return new DashboardStats(
        businessRepository.count(),
        businessRepository.countBySelfEmployedTrue(),
        businessRepository.countByWebsiteExistsTrue(),
        businessRepository.countByWebsiteExistsFalse(),
        businessRepository.countByProcessedTrue(),
        businessRepository.countByCreatedAtAfter(dayAgo),
        jobsByStatus,
        websiteCheckRepository.countByCreatedAtAfter(dayAgo));
  }

  /**
   * Builds the activity report for one UTC day.
   *
   * @param date the day to report on, or null for yesterday
   */
  public DailyReport dailyReport(@Nullable LocalDate date) {
    LocalDate day =
        date != null ? date : LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
    Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
    Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    return new DailyReport(
        day,
        businessRepository.countCreatedBetween(from, to),
        websiteCheckRepository.countCreatedBetween(from, to),
        jobRepository.countFinishedBetween(JobStatus.COMPLETED, from, to),
        jobRepository.countFinishedBetween(JobStatus.FAILED, from, to),
        businessRepository.count(),
        businessRepository.countBySelfEmployedTrueAndWebsiteExistsFalse());
  }

  public List<LabelCount> topCities(int limit) {
    return businessRepository.topCities(PageRequest.of(0, requireLimit(limit)));
  }

  public List<LabelCount> topIndustries(int limit) {
    return businessRepository.topIndustries(PageRequest.of(0, requireLimit(limit)));
  }

  public CheckSuccessRate websiteCheckSuccessRate(int days) {
    if (days < 1) {
      throw new IllegalArgumentException("days must be at least 1, got: " + days);
    }
    Instant since = clock.instant().minus(Duration.ofDays(days));
    long total = websiteCheckRepository.countByCreatedAtAfter(since);
    long successful = websiteCheckRepository.countByCreatedAtAfterAndErrorFalse(since);
    long found = websiteCheckRepository.countByCreatedAtAfterAndWebsiteExistsTrue(since);
    return new CheckSuccessRate(days, total, successful, found, percentage(successful, total));
  }

  public List<JobPerformance> jobPerformance() {
    Map<JobKind, Map<JobStatus, Long>> counts = new EnumMap<>(JobKind.class);
    for (KindStatusCount row : jobRepository.countByKindAndStatus()) {
      counts
          .computeIfAbsent(row.getKind(), kind -> new EnumMap<>(JobStatus.class))
          .put(row.getStatus(), row.getTotal());
    }
    Map<JobKind, List<Duration>> durations = new EnumMap<>(JobKind.class);
    for (Job job : jobRepository.findByStatus(JobStatus.COMPLETED)) {
      if (job.getStartedAt() != null && job.getCompletedAt() != null) {
        durations
            .computeIfAbsent(job.getKind(), kind -> new ArrayList<>())
            .add(Duration.between(job.getStartedAt(), job.getCompletedAt()));
      }
    }
    List<JobPerformance> result = new ArrayList<>();
    counts.forEach(
        (kind, byStatus) -> {
          long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
          long completed = byStatus.getOrDefault(JobStatus.COMPLETED, 0L);
          result.add(
              new JobPerformance(
                  kind.value(),
                  total,
                  completed,
                  byStatus.getOrDefault(JobStatus.FAILED, 0L),
                  byStatus.getOrDefault(JobStatus.CANCELLED, 0L),
                  percentage(completed, total),
                  averageSeconds(durations.get(kind))));
        });
    return result;
  }

  public List<Job> recentJobs(int limit) {
    return jobRepository.findByOrderByCreatedAtDesc(PageRequest.of(0, requireLimit(limit)));
  }

  public List<WebsiteCheck> recentChecks(int limit) {
    return websiteCheckRepository.findByOrderByCreatedAtDesc(
        PageRequest.of(0, requireLimit(limit)));
  }

  private static Double averageSeconds(List<Duration> durations) {
    if (durations == null || durations.isEmpty()) {
      return null;
    }
    return durations.stream().mapToLong(Duration::toMillis).average().orElse(0) / 1000.0;
  }

  static double percentage(long part, long total) {
    return total == 0 ? 0.0 : Math.round(part * 10000.0 / total) / 100.0;
  }

  private static int requireLimit(int limit) {
    if (limit < 1 || limit > 100) {
      throw new IllegalArgumentException("limit must be in [1, 100], got: " + limit);
    }
    return limit;
  }
}
