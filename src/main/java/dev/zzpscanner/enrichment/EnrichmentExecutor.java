package dev.zzpscanner.enrichment;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.business.ConfidenceScorer;
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
 * Runs {@code enrich-data} jobs over the given businesses, or the unprocessed ones up to {@code
 * scanner.enrichment.batch-ceiling}.
 *
 * <p>A business with both a name and a city is marked processed and gets its overall confidence
 * recomputed. One missing either is left for later and counted as skipped.
 */
@Component
public class EnrichmentExecutor extends AbstractJobExecutor {

  private static final Logger log = LoggerFactory.getLogger(EnrichmentExecutor.class);

  private final BusinessRepository businessRepository;
  private final int batchCeiling;

  public EnrichmentExecutor(
      JobLifecycleManager lifecycle,
      BusinessRepository businessRepository,
      ScannerProperties properties) {
    super(lifecycle);
    this.businessRepository = businessRepository;
    this.batchCeiling = properties.getEnrichment().getBatchCeiling();
  }

  @Override
  public Set<JobKind> kinds() {
    return Set.of(JobKind.ENRICH_DATA);
  }

  @Override
  protected JobCounters runBatch(long jobId, JobParameters parameters, TaskContext context) {
    List<Long> ids = parameters.getLongList(JobParameters.BUSINESS_IDS);
    List<Business> targets =
        ids == null
            ? businessRepository.findByProcessedFalseOrderByIdAsc(PageRequest.of(0, batchCeiling))
            : businessRepository.findByIdInOrderByIdAsc(ids);
    log.info("Enriching {} businesses for job {}", targets.size(), jobId);

    ItemTally tally = new ItemTally(targets.size());
    lifecycle.reportProgress(jobId, 0, tally.total());
    for (Business business : targets) {
      if (!context.pause(Duration.ZERO)) {
        log.info("Enrichment job {} stopping early ({})", jobId, context.stopReason());
        break;
      }
      enrich(jobId, business, tally);
      reportProgress(jobId, tally);
    }
    return tally.toCounters();
  }

  private void enrich(long jobId, Business business, ItemTally tally) {
    if (isBlank(business.getName()) || isBlank(business.getCity())) {
      log.debug(
          "Job {}: business {} lacks name or city, left unprocessed", jobId, business.getId());
      tally.skip();
      return;
    }
    try {
      business.setProcessed(true);
      business.setConfidenceScore(ConfidenceScorer.score(business));
      businessRepository.save(business);
      tally.success();
    } catch (RuntimeException e) {
      if (isBatchFatal(e)) {
        throw e;
      }
      log.warn("Job {}: error enriching business {}", jobId, business.getId(), e);
      tally.failure();
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
