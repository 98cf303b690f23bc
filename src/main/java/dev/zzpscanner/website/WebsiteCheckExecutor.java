package dev.zzpscanner.website;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.AbstractJobExecutor;
import dev.zzpscanner.job.ItemTally;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobLifecycleManager;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.dispatch.TaskContext;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Runs {@code check-website} jobs: one {@link WebsiteCheck} per business, with the business's
 * cached website fields updated alongside.
 *
 * <p>Targets the job's {@code business_ids} in ascending id order, or when absent the businesses
 * never checked so far, up to {@code scanner.website-check.batch-ceiling}. A business whose check
 * ends in a probe error, or whose processing throws, counts as failed; the batch goes on. A fixed
 * pause between businesses keeps the outbound request rate polite.
 */
@Component
public class WebsiteCheckExecutor extends AbstractJobExecutor {

  private static final Logger log = LoggerFactory.getLogger(WebsiteCheckExecutor.class);

  static final String CHECK_TYPE = "combined";

  private final BusinessRepository businessRepository;
  private final WebsiteChecker checker;
  private final WebsiteCheckRecorder recorder;
  private final int batchCeiling;
  private final Duration pacing;

  public WebsiteCheckExecutor(
      JobLifecycleManager lifecycle,
      BusinessRepository businessRepository,
      WebsiteChecker checker,
      WebsiteCheckRecorder recorder,
      ScannerProperties properties) {
    super(lifecycle);
    this.businessRepository = businessRepository;
    this.checker = checker;
    this.recorder = recorder;
    this.batchCeiling = properties.getWebsiteCheck().getBatchCeiling();
    this.pacing = properties.getWebsiteCheck().getPacing();
  }

  @Override
  public Set<JobKind> kinds() {
    return Set.of(JobKind.CHECK_WEBSITE);
  }

  @Override
  protected JobCounters runBatch(long jobId, JobParameters parameters, TaskContext context) {
    List<Business> targets = targets(jobId, parameters.getLongList(JobParameters.BUSINESS_IDS));
    log.info("Checking websites of {} businesses for job {}", targets.size(), jobId);

    ItemTally tally = new ItemTally(targets.size());
    lifecycle.reportProgress(jobId, 0, tally.total());
    for (Business business : targets) {
      if (!context.pause(tally.processed() == 0 ? Duration.ZERO : pacing)) {
        log.info("Website-check job {} stopping early ({})", jobId, context.stopReason());
        break;
      }
      checkOne(jobId, business, tally);
      reportProgress(jobId, tally);
    }
    return tally.toCounters();
  }

  private List<Business> targets(long jobId, List<Long> businessIds) {
    if (businessIds == null) {
      return businessRepository.findByLastCheckedIsNullOrderByIdAsc(
          PageRequest.of(0, batchCeiling));
    }
    List<Business> found = businessRepository.findByIdInOrderByIdAsc(businessIds);
    if (found.size() < businessIds.size()) {
      List<Long> foundIds = found.stream().map(Business::getId).toList();
      List<Long> missing = businessIds.stream().filter(id -> !foundIds.contains(id)).toList();
      log.warn("Job {}: businesses {} do not exist and are skipped", jobId, missing);
    }
    return found;
  }

  private void checkOne(long jobId, Business business, ItemTally tally) {
    try {
      WebsiteCheckOutcome outcome = checker.check(business.getName());
      recorder.record(business.getId(), CHECK_TYPE, outcome);
      if (outcome.error()) {
        log.warn(
            "Job {}: website check of business {} '{}' errored: {}",
            jobId,
            business.getId(),
            business.getName(),
            outcome.errorMessage());
        tally.failure();
      } else {
        log.debug(
            "Job {}: business {} website exists={} confidence={}",
            jobId,
            business.getId(),
            outcome.websiteExists(),
            outcome.confidenceScore());
        tally.success();
      }
    } catch (RuntimeException e) {
      if (isBatchFatal(e)) {
        throw e;
      }
      log.warn(
          "Job {}: error checking business {} '{}'",
          jobId,
          business.getId(),
          business.getName(),
          e);
      recordFailure(jobId, business, e);
      tally.failure();
    }
  }

  private void recordFailure(long jobId, Business business, RuntimeException cause) {
    try {
      recorder.record(business.getId(), CHECK_TYPE, WebsiteCheckOutcome.failed(messageOf(cause)));
    } catch (RuntimeException e) {
      if (isBatchFatal(e)) {
        throw e;
      }
      log.warn(
          "Job {}: could not record the failed check of business {}: {}",
          jobId,
          business.getId(),
          e.getMessage());
    }
  }
}
