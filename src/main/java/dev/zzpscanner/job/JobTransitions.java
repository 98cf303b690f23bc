package dev.zzpscanner.job;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies single state-machine steps to persisted jobs.
 *
 * <p>Each method runs in its own transaction and loads the job with a row lock, checks that the
 * step is legal from the current state, mutates and commits. Rejected steps throw before anything
 * is written. Reports that arrive after a job was cancelled are ignored, so a cancelled job stays
 * cancelled whatever its executor does next.
 *
 * <p>Dispatching is not done here: {@link JobLifecycleManager} calls the dispatcher after these
 * transactions commit, so a worker never looks for a job that is not visible yet.
 */
@Component
class JobTransitions {

  private static final Logger log = LoggerFactory.getLogger(JobTransitions.class);

  private final JobRepository jobRepository;
  private final Clock clock;

  JobTransitions(JobRepository jobRepository, Clock clock) {
    this.jobRepository = jobRepository;
    this.clock = clock;
  }

  @Transactional
  public Job create(String name, JobKind kind, JobParameters parameters, int maxRetries) {
    Job job = new Job(name, kind, parameters, maxRetries);
    job.setCreatedAt(now());
    Job saved = jobRepository.save(job);
    log.info("Created job {} '{}' ({}) with parameters {}", saved.getId(), name, kind.value(),
        parameters);
    return saved;
  }

  @Transactional
  public void linkTask(long jobId, String taskHandle) {
    Job job = lock(jobId);
    job.setTaskHandle(taskHandle);
  }

  /**
   * Moves a pending job to running.
   *
   * @return false if the job was cancelled before its executor got to it
   * @throws InvalidJobStateException if the job is neither pending nor cancelled
   */
  @Transactional
  public boolean start(long jobId) {
    Job job = lock(jobId);
    if (job.getStatus() == JobStatus.CANCELLED) {
      log.info("Job {} was cancelled before it started", jobId);
      return false;
    }
    if (job.getStatus() != JobStatus.PENDING) {
      throw new InvalidJobStateException(jobId, job.getStatus(), "only pending jobs can start");
    }
    job.setStatus(JobStatus.RUNNING);
    if (job.getStartedAt() == null) {
      job.setStartedAt(now());
    }
    log.info("Job {} running", jobId);
    return true;
  }

  /**
   * Stores a progress snapshot. Reports behind the stored one, and reports for a job that is not
   * running, are dropped.
   */
  @Transactional
  public void reportProgress(long jobId, int current, int total) {
    if (current < 0 || total < 0 || current > total) {
      throw new IllegalArgumentException(
          "Invalid progress %d/%d for job %d".formatted(current, total, jobId));
    }
    Job job = lock(jobId);
    if (job.getStatus() != JobStatus.RUNNING) {
      log.debug("Ignoring progress {}/{} for {} job {}", current, total, job.getStatus().value(),
          jobId);
      return;
    }
    JobCounters counters = job.getCounters();
    if (current < counters.processed()) {
      log.debug("Ignoring stale progress {}/{} for job {}", current, total, jobId);
      return;
    }
    job.setCounters(new JobCounters(total, current, counters.successful(), counters.failed()));
  }

  @Transactional
  public void complete(long jobId, JobCounters counters) {
    Job job = lock(jobId);
    if (job.getStatus() == JobStatus.CANCELLED) {
      log.info("Job {} already cancelled, dropping completion report {}", jobId, counters);
      return;
    }
    if (job.getStatus() != JobStatus.RUNNING) {
      throw new InvalidJobStateException(jobId, job.getStatus(), "only running jobs can complete");
    }
    job.setCounters(counters);
    job.setStatus(JobStatus.COMPLETED);
    job.setCompletedAt(now());
    log.info(
        "Job {} completed: total={} processed={} successful={} failed={} skipped={}",
        jobId,
        counters.total(),
        counters.processed(),
        counters.successful(),
        counters.failed(),
        counters.skipped());
  }

  @Transactional
  public void fail(long jobId, String errorMessage) {
    Job job = lock(jobId);
    if (job.getStatus() == JobStatus.CANCELLED) {
      log.info("Job {} already cancelled, dropping failure report: {}", jobId, errorMessage);
      return;
    }
    if (job.getStatus() != JobStatus.RUNNING) {
      throw new InvalidJobStateException(jobId, job.getStatus(), "only running jobs can fail");
    }
    job.setStatus(JobStatus.FAILED);
    job.setErrorMessage(errorMessage);
    job.setCompletedAt(now());
    log.warn("Job {} failed: {}", jobId, errorMessage);
  }

  /**
   * Cancels a pending or running job.
   *
   * @return the cancelled job, whose task handle the caller uses to stop the worker
   */
  @Transactional
  public Job cancel(long jobId) {
    Job job = lock(jobId);
    if (!job.getStatus().isCancellable()) {
      throw new InvalidJobStateException(
          jobId, job.getStatus(), "only pending or running jobs can be cancelled");
    }
    job.setStatus(JobStatus.CANCELLED);
    job.setCompletedAt(now());
    log.info("Job {} cancelled", jobId);
    return job;
  }

  /** Returns a failed job with retries left to pending and counts the retry. */
  @Transactional
  public Job prepareRetry(long jobId) {
    Job job = lock(jobId);
    if (job.getStatus() != JobStatus.FAILED) {
      throw new InvalidJobStateException(jobId, job.getStatus(), "only failed jobs can be retried");
    }
    if (!job.canRetry()) {
      throw new RetryExhaustedException(jobId, job.getMaxRetries());
    }
    job.setRetryCount(job.getRetryCount() + 1);
    job.setErrorMessage(null);
    job.setCompletedAt(null);
    job.setTaskHandle(null);
    // the new run reports progress from zero again
    job.setCounters(JobCounters.ZERO);
    job.setStatus(JobStatus.PENDING);
    log.info("Job {} queued for retry {}/{}", jobId, job.getRetryCount(), job.getMaxRetries());
    return job;
  }

  private Job lock(long jobId) {
    return jobRepository
        .findByIdForUpdate(jobId)
        .orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private Instant now() {
    return clock.instant();
  }
}
