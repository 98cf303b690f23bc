package dev.zzpscanner.website;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessNotFoundException;
import dev.zzpscanner.business.BusinessRepository;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores a check outcome: inserts the {@link WebsiteCheck} row and overwrites the business's
 * cached website fields in one transaction, so neither is visible without the other.
 *
 * <p>The cache is overwritten whatever the outcome, negative or errored ones included.
 */
@Service
public class WebsiteCheckRecorder {

  private final BusinessRepository businessRepository;
  private final WebsiteCheckRepository websiteCheckRepository;
  private final Clock clock;

  public WebsiteCheckRecorder(
      BusinessRepository businessRepository,
      WebsiteCheckRepository websiteCheckRepository,
      Clock clock) {
    this.businessRepository = businessRepository;
    this.websiteCheckRepository = websiteCheckRepository;
    this.clock = clock;
  }

  @Transactional
  public WebsiteCheck record(long businessId, String checkType, WebsiteCheckOutcome outcome) {
    Business business =
        businessRepository
            .findById(businessId)
            .orElseThrow(() -> new BusinessNotFoundException(businessId));
    Instant now = clock.instant();
    business.recordWebsiteCheck(
        outcome.websiteExists(), outcome.websiteUrl(), outcome.confidenceScore(), now);
    businessRepository.save(business);
    return websiteCheckRepository.save(new WebsiteCheck(business, checkType, outcome, now));
  }
}
