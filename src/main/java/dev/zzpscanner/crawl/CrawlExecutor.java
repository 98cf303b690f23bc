package dev.zzpscanner.crawl;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.AbstractJobExecutor;
import dev.zzpscanner.job.ItemTally;
import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobLifecycleManager;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.dispatch.TaskContext;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs discovery jobs: asks the {@link DiscoverySource} for the job's kind for candidates and adds
 * the ones the catalog does not know yet.
 *
 * <p>A candidate whose {@code (source, sourceId)} already exists is skipped: it counts as
 * processed but neither successful nor failed, and is logged as already known. A candidate that
 * cannot be saved is logged and counted failed; the batch goes on unless the record store itself
 * is unreachable.
 */
@Component
public class CrawlExecutor extends AbstractJobExecutor {

  private static final Logger log = LoggerFactory.getLogger(CrawlExecutor.class);

  private final Map<JobKind, DiscoverySource> sources = new EnumMap<>(JobKind.class);
  private final BusinessRepository businessRepository;
  private final Duration delay;

  public CrawlExecutor(
      JobLifecycleManager lifecycle,
      List<DiscoverySource> discoverySources,
      BusinessRepository businessRepository,
      ScannerProperties properties) {
    super(lifecycle);
    for (DiscoverySource source : discoverySources) {
      for (JobKind kind : source.kinds()) {
        sources.putIfAbsent(kind, source);
      }
    }
    this.businessRepository = businessRepository;
    this.delay = properties.getCrawl().getDelay();
  }

  @Override
  public Set<JobKind> kinds() {
    return sources.keySet();
  }

  @Override
  protected JobCounters runBatch(long jobId, JobParameters parameters, TaskContext context) {
    String location = parameters.getString(JobParameters.TARGET_LOCATION);
    if (location == null || location.isBlank()) {
      throw new IllegalArgumentException("Discovery job has no " + JobParameters.TARGET_LOCATION);
    }
    String industry = parameters.getString(JobParameters.TARGET_INDUSTRY);
    Job job = lifecycle.getJob(jobId);
    DiscoverySource source = sources.get(job.getKind());
    if (source == null) {
      throw new IllegalStateException("No discovery source for " + job.getKind().value());
    }

    List<DiscoveredBusiness> candidates = source.discover(job.getKind(), location, industry);
    log.info(
        "Discovering {} candidates for job {} in '{}' (industry: {})",
        candidates.size(),
        jobId,
        location,
        industry == null ? "any" : industry);

    ItemTally tally = new ItemTally(candidates.size());
    lifecycle.reportProgress(jobId, 0, tally.total());
    for (DiscoveredBusiness candidate : candidates) {
      if (!context.pause(tally.processed() == 0 ? Duration.ZERO : delay)) {
        log.info("Discovery job {} stopping early ({})", jobId, context.stopReason());
        break;
      }
      process(jobId, candidate, tally);
      reportProgress(jobId, tally);
    }
    return tally.toCounters();
  }

  private void process(long jobId, DiscoveredBusiness candidate, ItemTally tally) {
    try {
      if (businessRepository.existsBySourceAndSourceId(candidate.source(), candidate.sourceId())) {
        log.info(
            "Job {}: business {}/{} already exists, skipping",
            jobId,
            candidate.source(),
            candidate.sourceId());
        tally.skip();
        return;
      }
      Business saved = businessRepository.save(candidate.toBusiness());
      log.debug("Job {}: added business {} '{}'", jobId, saved.getId(), saved.getName());
      tally.success();
    } catch (RuntimeException e) {
      if (isBatchFatal(e)) {
        throw e;
      }
      log.warn(
          "Job {}: error saving business {}/{}: {}",
          jobId,
          candidate.source(),
          candidate.sourceId(),
          e.getMessage(),
          e);
      tally.failure();
    }
  }
}
