package dev.zzpscanner.website;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessNotFoundException;
import dev.zzpscanner.business.BusinessRepository;
import jakarta.persistence.criteria.Predicate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Website-check history queries and on-demand checks of a single business outside any job. */
@Service
public class WebsiteCheckService {

  private static final Logger log = LoggerFactory.getLogger(WebsiteCheckService.class);

  static final String CHECK_TYPE_SINGLE = "single";

  private final WebsiteCheckRepository websiteCheckRepository;
  private final BusinessRepository businessRepository;
  private final WebsiteChecker checker;
  private final WebsiteCheckRecorder recorder;

  public WebsiteCheckService(
      WebsiteCheckRepository websiteCheckRepository,
      BusinessRepository businessRepository,
      WebsiteChecker checker,
      WebsiteCheckRecorder recorder) {
    this.websiteCheckRepository = websiteCheckRepository;
    this.businessRepository = businessRepository;
    this.checker = checker;
    this.recorder = recorder;
  }

  /**
   * Probes one business now and records the outcome like a job would. Runs on the caller's
   * thread, so it blocks for as long as the probes take.
   */
  public WebsiteCheck checkBusiness(long businessId) {
    Business business =
        businessRepository
            .findById(businessId)
            .orElseThrow(() -> new BusinessNotFoundException(businessId));
    WebsiteCheckOutcome outcome = checker.check(business.getName());
    WebsiteCheck check = recorder.record(businessId, CHECK_TYPE_SINGLE, outcome);
    log.info(
        "Single website check of business {}: exists={} confidence={}",
        businessId,
        outcome.websiteExists(),
        outcome.confidenceScore());
    return check;
  }

  @Transactional(readOnly = true)
  public List<WebsiteCheck> list(
      @Nullable Long businessId, @Nullable String checkType, Pageable pageable) {
    Specification<WebsiteCheck> spec =
        (root, query, cb) -> {
          List<Predicate> predicates = new ArrayList<>();
          if (businessId != null) {
            predicates.add(cb.equal(root.get("businessId"), businessId));
          }
          if (checkType != null && !checkType.isBlank()) {
            predicates.add(cb.equal(root.get("checkType"), checkType));
          }
          return cb.and(predicates.toArray(new Predicate[0]));
        };
    return websiteCheckRepository.findAll(spec, pageable).getContent();
  }

  @Transactional(readOnly = true)
  public WebsiteCheck get(long id) {
    return websiteCheckRepository
        .findById(id)
        .orElseThrow(() -> new WebsiteCheckNotFoundException(id));
  }

  /** All checks of a business, newest first. */
  @Transactional(readOnly = true)
  public List<WebsiteCheck> forBusiness(long businessId) {
    if (!businessRepository.existsById(businessId)) {
      throw new BusinessNotFoundException(businessId);
    }
    return websiteCheckRepository.findByBusinessIdOrderByCreatedAtDesc(businessId);
  }
}
