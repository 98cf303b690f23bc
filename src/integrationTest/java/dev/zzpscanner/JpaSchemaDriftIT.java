package dev.zzpscanner;

import static org.assertj.core.api.Assertions.assertThat;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.JobRepository;
import dev.zzpscanner.job.JobStatus;
import dev.zzpscanner.website.WebsiteCheck;
import dev.zzpscanner.website.WebsiteCheckOutcome;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=validate only checking column presence by persisting each entity and
 * reading it back against the Flyway schema, including the JSONB and converted enum columns.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private BusinessRepository businessRepository;

  @Autowired private JobRepository jobRepository;

  @Autowired private WebsiteCheckRepository websiteCheckRepository;

  @Test
  void businessEntityRoundtripsAgainstFlywaySchema() {
    Business business = new Business("Drift Bakkerij");
    business.setCity("Zwolle");
    business.setCountry("Netherlands");
    business.setSource("google_maps");
    business.setSourceId("gm_1_drift");
    business.setRawData(Map.of("generator", "placeholder", "rank", 3));
    business.setConfidenceScore(0.75);

    Business saved = businessRepository.saveAndFlush(business);
    Business found = businessRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getUuid()).isNotNull();
    assertThat(found.getRawData())
        .containsEntry("generator", "placeholder")
        .containsEntry("rank", 3);
    assertThat(found.getConfidenceScore()).isEqualTo(0.75);
    assertThat(found.isSelfEmployed()).isTrue();
    assertThat(found.getWebsiteExists()).isNull();
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(businessRepository.existsBySourceAndSourceId("google_maps", "gm_1_drift")).isTrue();
  }

  @Test
  void jobEntityRoundtripsAgainstFlywaySchema() {
    Job job =
        new Job(
            "Website check",
            JobKind.CHECK_WEBSITE,
            JobParameters.businessIds(List.of(4L, 5L)),
            3);

    Job saved = jobRepository.saveAndFlush(job);
    Job found = jobRepository.findByIdForUpdate(saved.getId()).orElseThrow();

    assertThat(found.getKind()).isEqualTo(JobKind.CHECK_WEBSITE);
    assertThat(found.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(found.getParameters().getLongList(JobParameters.BUSINESS_IDS))
        .containsExactly(4L, 5L);
    assertThat(found.getCounters()).isEqualTo(JobCounters.ZERO);
    assertThat(found.getMaxRetries()).isEqualTo(3);
  }

  @Test
  void websiteCheckEntityRoundtripsAgainstFlywaySchema() {
    Business business = businessRepository.saveAndFlush(new Business("Drift Studio"));
    WebsiteCheckOutcome outcome =
        new WebsiteCheckOutcome(
            true,
            0.9,
            "https://driftstudio.nl",
            "https://driftstudio.nl",
            200,
            0.12,
            Map.of("a", List.of("192.0.2.10")),
            Map.of("Server", "nginx"),
            null,
            false);

    WebsiteCheck saved =
        websiteCheckRepository.saveAndFlush(
            new WebsiteCheck(business, "combined", outcome, Instant.parse("2026-03-01T12:00:00Z")));
    WebsiteCheck found = websiteCheckRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getBusinessId()).isEqualTo(business.getId());
    assertThat(found.getUrlChecked()).isEqualTo("https://driftstudio.nl");
    assertThat(found.getStatusCode()).isEqualTo(200);
    assertThat(found.getHeaders()).containsEntry("Server", "nginx");
    assertThat(found.isError()).isFalse();
  }
}
