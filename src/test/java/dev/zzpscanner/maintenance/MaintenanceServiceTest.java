package dev.zzpscanner.maintenance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.fixture.BusinessBuilder;
import dev.zzpscanner.job.JobRepository;
import dev.zzpscanner.job.JobStatus;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

@ExtendWith(MockitoExtension.class)
class MaintenanceServiceTest {

  private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

  @Mock BusinessRepository businessRepository;

  @Mock WebsiteCheckRepository websiteCheckRepository;

  @Mock JobRepository jobRepository;

  @Captor ArgumentCaptor<Iterable<Business>> deleted;

  MaintenanceService service;

  @BeforeEach
  void setUp() {
    service =
        new MaintenanceService(
            businessRepository,
            websiteCheckRepository,
            jobRepository,
            new ScannerProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void deduplicateKeepsHighestConfidenceThenLowestId() {
    Business first = new BusinessBuilder().id(1L).name("Studio Noord").confidenceScore(0.5).build();
    Business best = new BusinessBuilder().id(2L).name("studio noord").confidenceScore(0.8).build();
    Business tie = new BusinessBuilder().id(3L).name("STUDIO NOORD").confidenceScore(0.8).build();
    Business other = new BusinessBuilder().id(4L).name("Studio Noord").city("Utrecht").build();
    given(businessRepository.findAll(any(Sort.class))).willReturn(List.of(first, best, tie, other));

    int removed = service.deduplicate();

    assertThat(removed).isEqualTo(2);
    verify(businessRepository).deleteAll(deleted.capture());
    assertThat(deleted.getValue()).containsExactlyInAnyOrder(first, tie);
  }

  @Test
  void deduplicateLeavesBusinessesWithoutCityAlone() {
    Business first = new BusinessBuilder().id(1L).name("Jan Jansen").city(null).build();
    Business second = new BusinessBuilder().id(2L).name("Jan Jansen").city(null).build();
    given(businessRepository.findAll(any(Sort.class))).willReturn(List.of(first, second));

    int removed = service.deduplicate();

    assertThat(removed).isZero();
    verify(businessRepository).deleteAll(deleted.capture());
    assertThat(deleted.getValue()).isEmpty();
  }

  @Test
  void recalculateCountsOnlyChangedScores() {
    Business stale = new BusinessBuilder().id(1L).confidenceScore(0.1).build();
    Business current = new BusinessBuilder().id(2L).confidenceScore(0.6).build();
    given(businessRepository.findAll()).willReturn(List.of(stale, current));

    int changed = service.recalculateConfidenceScores();

    assertThat(changed).isEqualTo(1);
    assertThat(stale.getConfidenceScore()).isEqualTo(0.6);
  }

  @Test
  void cleanupUsesConfiguredRetentionByDefault() {
    Instant cutoff = NOW.minusSeconds(90L * 24 * 3600);
    given(websiteCheckRepository.deleteCreatedBefore(cutoff)).willReturn(12);
    given(
            jobRepository.deleteFinishedBefore(
                List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED), cutoff))
        .willReturn(3);
    given(businessRepository.deleteNonSelfEmployedWithoutWebsiteBefore(cutoff)).willReturn(1);

    CleanupResult result = service.cleanup(null);

    assertThat(result).isEqualTo(new CleanupResult(cutoff, 12, 3, 1));
  }

  @Test
  void cleanupRejectsNonPositiveRetention() {
    assertThatThrownBy(() -> service.cleanup(0)).isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(websiteCheckRepository, jobRepository);
  }

  @Test
  void dedupKeyIgnoresCase() {
    Business a = new BusinessBuilder().name("Bakker").city("Delft").build();
    Business b = new BusinessBuilder().name("BAKKER").city("delft").build();

    assertThat(MaintenanceService.dedupKey(a)).isEqualTo(MaintenanceService.dedupKey(b));
  }
}
