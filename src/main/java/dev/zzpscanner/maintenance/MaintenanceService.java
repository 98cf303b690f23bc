package dev.zzpscanner.maintenance;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.business.ConfidenceScorer;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.JobRepository;
import dev.zzpscanner.job.JobStatus;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Catalog housekeeping: duplicate removal, confidence recalculation and retention cleanup.
 *
 * <p>All three operate on the whole catalog in one transaction each.
 */
@Service
public class MaintenanceService {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

  private final BusinessRepository businessRepository;
  private final WebsiteCheckRepository websiteCheckRepository;
  private final JobRepository jobRepository;
  private final ScannerProperties properties;
  private final Clock clock;

  public MaintenanceService(
      BusinessRepository businessRepository,
      WebsiteCheckRepository websiteCheckRepository,
      JobRepository jobRepository,
      ScannerProperties properties,
      Clock clock) {
    this.businessRepository = businessRepository;
    this.websiteCheckRepository = websiteCheckRepository;
    this.jobRepository = jobRepository;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Removes businesses sharing a case-insensitive name and city, keeping the one with the highest
   * overall confidence (lowest id on ties). Businesses without a city are never grouped.
   *
   * @return number of businesses removed
   */
  @Transactional
  public int deduplicate() {
    Map<String, List<Business>> groups = new LinkedHashMap<>();
    for (Business business : businessRepository.findAll(Sort.by("id"))) {
      if (business.getName() == null || business.getCity() == null) {
        continue;
      }
      groups.computeIfAbsent(dedupKey(business), key -> new ArrayList<>()).add(business);
    }
    List<Business> duplicates = new ArrayList<>();
    for (List<Business> group : groups.values()) {
      if (group.size() < 2) {
        continue;
      }
      Business keep =
          group.stream()
              .max(
                  Comparator.comparingDouble(Business::getConfidenceScore)
                      .thenComparing(Business::getId, Comparator.reverseOrder()))
              .orElseThrow();
      group.stream().filter(b -> b != keep).forEach(duplicates::add);
    }
    businessRepository.deleteAll(duplicates);
    log.info("Removed {} duplicate businesses", duplicates.size());
    return duplicates.size();
  }

  /**
   * Recomputes the overall confidence of every business from its populated fields.
   *
   * @return number of businesses whose score changed
   */
  @Transactional
  public int recalculateConfidenceScores() {
    int changed = 0;
    for (Business business : businessRepository.findAll()) {
      double score = ConfidenceScorer.score(business);
      if (Double.compare(score, business.getConfidenceScore()) != 0) {
        business.setConfidenceScore(score);
        changed++;
      }
    }
    log.info("Recalculated confidence scores, {} changed", changed);
    return changed;
  }

  /**
   * Deletes checks, finished jobs and businesses older than the retention period. Only businesses
   * that are not self-employed and were found to have no website are deleted.
   *
   * @param retentionDays days to keep, or null for {@code scanner.maintenance.retention-days}
   */
  @Transactional
  public CleanupResult cleanup(@Nullable Integer retentionDays) {
    int days =
        retentionDays != null ? retentionDays : properties.getMaintenance().getRetentionDays();
    if (days < 1) {
      throw new IllegalArgumentException("Retention must be at least 1 day, got: " + days);
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(days));
    int checks = websiteCheckRepository.deleteCreatedBefore(cutoff);
    int jobs =
        jobRepository.deleteFinishedBefore(
            List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED), cutoff);
    int businesses = businessRepository.deleteNonSelfEmployedWithoutWebsiteBefore(cutoff);
    log.info(
        "Cleanup before {}: {} checks, {} jobs, {} businesses deleted",
        cutoff,
        checks,
        jobs,
        businesses);
    return new CleanupResult(cutoff, checks, jobs, businesses);
  }

  static String dedupKey(Business business) {
    return business.getName().toLowerCase(Locale.ROOT)
        + "_"
        + business.getCity().toLowerCase(Locale.ROOT);
  }
}
