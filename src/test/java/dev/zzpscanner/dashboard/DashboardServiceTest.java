package dev.zzpscanner.dashboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.fixture.JobBuilder;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobRepository;
import dev.zzpscanner.job.JobStatus;
import dev.zzpscanner.job.KindStatusCount;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

  private static final Instant NOW = Instant.parse("2026-05-20T12:00:00Z");

  @Mock BusinessRepository businessRepository;

  @Mock JobRepository jobRepository;

  @Mock WebsiteCheckRepository websiteCheckRepository;

  DashboardService service;

  @BeforeEach
  void setUp() {
    service =
        new DashboardService(
            businessRepository,
            jobRepository,
            websiteCheckRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void statsListsEveryJobStatus() {
    given(businessRepository.count()).willReturn(10L);
    given(jobRepository.countByStatus(any(JobStatus.class))).willReturn(0L);
    given(jobRepository.countByStatus(JobStatus.RUNNING)).willReturn(2L);

    DashboardStats stats = service.stats();

    assertThat(stats.totalBusinesses()).isEqualTo(10L);
    assertThat(stats.jobsByStatus())
        .containsOnlyKeys("pending", "running", "completed", "failed", "cancelled")
        .containsEntry("running", 2L);
  }

  @Test
  void dailyReportDefaultsToYesterdayInUtc() {
    Instant from = Instant.parse("2026-05-19T00:00:00Z");
    Instant to = Instant.parse("2026-05-20T00:00:00Z");
    given(businessRepository.countCreatedBetween(from, to)).willReturn(4L);
    given(websiteCheckRepository.countCreatedBetween(from, to)).willReturn(9L);
    given(jobRepository.countFinishedBetween(JobStatus.COMPLETED, from, to)).willReturn(2L);
    given(jobRepository.countFinishedBetween(JobStatus.FAILED, from, to)).willReturn(1L);
    given(businessRepository.count()).willReturn(120L);
    given(businessRepository.countBySelfEmployedTrueAndWebsiteExistsFalse()).willReturn(35L);

    DailyReport report = service.dailyReport(null);

    assertThat(report)
        .isEqualTo(new DailyReport(LocalDate.of(2026, 5, 19), 4, 9, 2, 1, 120, 35));
  }

  @Test
  void dailyReportCoversTheRequestedDay() {
    Instant from = Instant.parse("2026-03-01T00:00:00Z");
    Instant to = Instant.parse("2026-03-02T00:00:00Z");
    given(businessRepository.countCreatedBetween(from, to)).willReturn(1L);

    DailyReport report = service.dailyReport(LocalDate.of(2026, 3, 1));

    assertThat(report.date()).isEqualTo(LocalDate.of(2026, 3, 1));
    assertThat(report.newBusinesses()).isEqualTo(1L);
    assertThat(report.completedJobs()).isZero();
  }

  @Test
  void successRateIsPercentageOfNonErrorChecks() {
    Instant since = NOW.minusSeconds(7L * 24 * 3600);
    given(websiteCheckRepository.countByCreatedAtAfter(since)).willReturn(8L);
    given(websiteCheckRepository.countByCreatedAtAfterAndErrorFalse(since)).willReturn(6L);
    given(websiteCheckRepository.countByCreatedAtAfterAndWebsiteExistsTrue(since)).willReturn(3L);

    CheckSuccessRate rate = service.websiteCheckSuccessRate(7);

    assertThat(rate).isEqualTo(new CheckSuccessRate(7, 8, 6, 3, 75.0));
  }

  @Test
  void jobPerformanceAveragesCompletedDurations() {
    given(jobRepository.countByKindAndStatus())
        .willReturn(
            List.of(
                row(JobKind.CHECK_WEBSITE, JobStatus.COMPLETED, 2),
                row(JobKind.CHECK_WEBSITE, JobStatus.FAILED, 2)));
    Instant start = NOW.minusSeconds(100);
    given(jobRepository.findByStatus(JobStatus.COMPLETED))
        .willReturn(
            List.of(
                new JobBuilder()
                    .kind(JobKind.CHECK_WEBSITE)
                    .startedAt(start)
                    .completedAt(start.plusSeconds(10))
                    .build(),
                new JobBuilder()
                    .kind(JobKind.CHECK_WEBSITE)
                    .startedAt(start)
                    .completedAt(start.plusSeconds(30))
                    .build()));

    List<JobPerformance> performance = service.jobPerformance();

    assertThat(performance)
        .containsExactly(new JobPerformance("check-website", 4, 2, 2, 0, 50.0, 20.0));
  }

  @Test
  void limitOutsideRangeIsRejected() {
    assertThatThrownBy(() -> service.topCities(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.recentJobs(101))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void percentageOfEmptyTotalIsZero() {
    assertThat(DashboardService.percentage(0, 0)).isEqualTo(0.0);
    assertThat(DashboardService.percentage(1, 3)).isEqualTo(33.33);
  }

  private static KindStatusCount row(JobKind kind, JobStatus status, long total) {
    return new KindStatusCount() {
      @Override
      public JobKind getKind() {
        return kind;
      }

      @Override
      public JobStatus getStatus() {
        return status;
      }

      @Override
      public long getTotal() {
        return total;
      }
    };
  }
}
