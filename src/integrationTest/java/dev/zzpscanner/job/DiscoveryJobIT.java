package dev.zzpscanner.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.zzpscanner.BaseIntegrationTest;
import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

@TestPropertySource(properties = "scanner.crawl.delay=0ms")
class DiscoveryJobIT extends BaseIntegrationTest {

  @Autowired private JobLifecycleManager lifecycle;

  @Autowired private BusinessRepository businessRepository;

  @Test
  void discoveryStoresNewBusinessesAndSkipsKnownOnes() throws Exception {
    Job first =
        lifecycle.createJob(
            JobKind.DISCOVER_CHAMBER_OF_COMMERCE, JobParameters.discovery("Deventer, NL", null));

    Job done = JobAwait.terminal(lifecycle, first.getId());

    assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.getCounters()).isEqualTo(new JobCounters(2, 2, 2, 0));
    assertThat(done.getStartedAt()).isNotNull();
    assertThat(done.getCompletedAt()).isAfterOrEqualTo(done.getStartedAt());
    assertThat(
            businessRepository.existsBySourceAndSourceId(
                "chamber_of_commerce", "kvk_1_deventer-nl"))
        .isTrue();

    Job second =
        lifecycle.createJob(
            JobKind.DISCOVER_CHAMBER_OF_COMMERCE, JobParameters.discovery("Deventer, NL", null));

    Job repeated = JobAwait.terminal(lifecycle, second.getId());

    assertThat(repeated.getCounters()).isEqualTo(new JobCounters(2, 2, 0, 0));
    List<Business> stored =
        businessRepository.findAll().stream()
            .filter(b -> "Deventer".equals(b.getCity()))
            .toList();
    assertThat(stored).hasSize(2).allMatch(b -> "NL".equals(b.getCountry()));
  }

  @Test
  void finishedJobCannotBeCancelled() throws Exception {
    Job job =
        lifecycle.createJob(JobKind.DISCOVER_FACEBOOK, JobParameters.discovery("Leiden", "Yoga"));
    Job done = JobAwait.terminal(lifecycle, job.getId());

    assertThatThrownBy(() -> lifecycle.cancelJob(done.getId()))
        .isInstanceOf(InvalidJobStateException.class);
    assertThat(lifecycle.getJob(done.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void completedJobCannotBeRetried() throws Exception {
    Job job =
        lifecycle.createJob(JobKind.DISCOVER_LINKEDIN, JobParameters.discovery("Delft", null));
    JobAwait.terminal(lifecycle, job.getId());

    assertThatThrownBy(() -> lifecycle.retryJob(job.getId()))
        .isInstanceOf(IllegalStateException.class);
  }
}
