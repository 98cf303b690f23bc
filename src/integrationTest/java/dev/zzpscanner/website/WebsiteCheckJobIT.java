package dev.zzpscanner.website;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.willReturn;
import static org.mockito.BDDMockito.willThrow;

import dev.zzpscanner.BaseIntegrationTest;
import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobAwait;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobLifecycleManager;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.JobStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@TestPropertySource(properties = "scanner.website-check.pacing=0ms")
class WebsiteCheckJobIT extends BaseIntegrationTest {

  @MockitoBean private WebsiteProbe probe;

  @Autowired private JobLifecycleManager lifecycle;

  @Autowired private BusinessRepository businessRepository;

  @Autowired private WebsiteCheckRepository websiteCheckRepository;

  @BeforeEach
  void stubNetwork() {
    willThrow(new DomainNotFoundException("unregistered")).given(probe).resolve(anyString());
    willReturn(List.of("192.0.2.44")).given(probe).resolve("atelierwestwijk.com");
    HttpProbeResult redirect =
        new HttpProbeResult(
            301, Map.of("Location", "https://www.atelierwestwijk.com/"), Duration.ofMillis(40));
    willReturn(redirect).given(probe).fetch("https://atelierwestwijk.com");
  }

  @Test
  void checksExplicitBusinessesAndCachesTheResult() throws Exception {
    Business found = businessRepository.saveAndFlush(new Business("Atelier Westwijk"));
    Business missing = businessRepository.saveAndFlush(new Business("Klusbedrijf Oostwijk"));

    Job job =
        lifecycle.createJob(
            JobKind.CHECK_WEBSITE,
            JobParameters.businessIds(List.of(found.getId(), missing.getId())));
    Job done = JobAwait.terminal(lifecycle, job.getId());

    assertThat(done.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(done.getCounters()).isEqualTo(new JobCounters(2, 2, 2, 0));

    Business foundAfter = businessRepository.findById(found.getId()).orElseThrow();
    assertThat(foundAfter.getWebsiteExists()).isTrue();
    assertThat(foundAfter.getWebsiteUrl()).isEqualTo("https://atelierwestwijk.com");
    assertThat(foundAfter.getWebsiteConfidenceScore()).isEqualTo(0.7);
    assertThat(foundAfter.getLastChecked()).isNotNull();

    Business missingAfter = businessRepository.findById(missing.getId()).orElseThrow();
    assertThat(missingAfter.getWebsiteExists()).isFalse();
    assertThat(missingAfter.getLastChecked()).isNotNull();

    List<WebsiteCheck> checks =
        websiteCheckRepository.findByBusinessIdOrderByCreatedAtDesc(missing.getId());
    assertThat(checks).hasSize(1);
    assertThat(checks.get(0).getCheckType()).isEqualTo("combined");
    assertThat(checks.get(0).getUrlChecked()).isEqualTo("https://klusbedrijfoostwijk.nl");
    assertThat(checks.get(0).isError()).isFalse();
  }
}
