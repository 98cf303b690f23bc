package dev.zzpscanner.job;

import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.dispatch.JobDispatcher;
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

/**
 * Owns the job state machine: creates and dispatches jobs, cancels and retries them, and records
 * what executors report while running.
 *
 * <p>Legal transitions:
 *
 * <ul>
 *   <li>pending to running, when the executor starts
 *   <li>running to completed or failed, when the executor reports its outcome
 *   <li>pending or running to cancelled, on request; the worker is told to stop
 *   <li>failed to pending, on retry while {@code retryCount < maxRetries}
 * </ul>
 *
 * <p>Anything else is rejected with {@link InvalidJobStateException} and leaves the job unchanged.
 * Each step is its own transaction (see {@link JobTransitions}); the dispatcher is only called once
 * the step that precedes it has committed.
 */
@Service
public class JobLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(JobLifecycleManager.class);

  private final JobTransitions transitions;
  private final JobRepository jobRepository;
  private final JobDispatcher dispatcher;
  private final ScannerProperties properties;

  JobLifecycleManager(
      JobTransitions transitions,
      JobRepository jobRepository,
      JobDispatcher dispatcher,
      ScannerProperties properties) {
    this.transitions = transitions;
    this.jobRepository = jobRepository;
    this.dispatcher = dispatcher;
    this.properties = properties;
  }

  /**
   * Persists a pending job and hands it to the dispatcher.
   *
   * @param kind what the job does
   * @param parameters kind-specific input; discovery kinds require a target location
   * @return the created job, already linked to its task
   * @throws IllegalArgumentException if the parameters do not fit the kind
   */
  public Job createJob(JobKind kind, JobParameters parameters) {
    validate(kind, parameters);
    Job job =
        transitions.create(
            describe(kind, parameters), kind, parameters, properties.getJobs().getMaxRetries());
    dispatch(job.getId(), kind, parameters);
    return getJob(job.getId());
  }

  @Transactional(readOnly = true)
  public Job getJob(long jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @Transactional(readOnly = true)
  public List<Job> listJobs(@Nullable JobStatus status, @Nullable JobKind kind, Pageable pageable) {
    Specification<Job> spec =
        (root, query, cb) -> {
          List<Predicate> predicates = new ArrayList<>();
          if (status != null) {
            predicates.add(cb.equal(root.get("status"), status));
          }
          if (kind != null) {
            predicates.add(cb.equal(root.get("kind"), kind));
          }
          return cb.and(predicates.toArray(new Predicate[0]));
        };
    return jobRepository.findAll(spec, pageable).getContent();
  }

  /**
   * Cancels a pending or running job and asks the dispatcher to stop its task.
   *
   * @throws InvalidJobStateException if the job already finished
   */
  public Job cancelJob(long jobId) {
    Job job = transitions.cancel(jobId);
    if (job.getTaskHandle() != null) {
      dispatcher.cancel(job.getTaskHandle());
    }
    return job;
  }

  /**
   * Puts a failed job back to pending and dispatches it again with its original parameters. A
   * website-check retry targets every unchecked business rather than the original selection.
   *
   * @throws RetryExhaustedException if the job has no retries left
   * @throws InvalidJobStateException if the job is not failed
   */
  public Job retryJob(long jobId) {
    Job job = transitions.prepareRetry(jobId);
    JobParameters parameters = job.getParameters();
    if (job.getKind() == JobKind.CHECK_WEBSITE) {
      parameters = parameters.without(JobParameters.BUSINESS_IDS);
    }
    dispatch(jobId, job.getKind(), parameters);
    return getJob(jobId);
  }

  /**
   * Called by an executor before its first item.
   *
   * @return false if the job was cancelled meanwhile and the executor must not run
   */
  public boolean start(long jobId) {
    return transitions.start(jobId);
  }

  public void reportProgress(long jobId, int current, int total) {
    transitions.reportProgress(jobId, current, total);
  }

  public void complete(long jobId, JobCounters counters) {
    transitions.complete(jobId, counters);
  }

  public void fail(long jobId, String errorMessage) {
    transitions.fail(jobId, errorMessage);
  }

  private void dispatch(long jobId, JobKind kind, JobParameters parameters) {
    String handle;
    try {
      handle = dispatcher.startJob(jobId, kind, parameters);
    } catch (RuntimeException e) {
      log.error("Could not dispatch job {}, cancelling it", jobId, e);
      transitions.cancel(jobId);
      throw e;
    }
    transitions.linkTask(jobId, handle);
  }

  private static void validate(JobKind kind, JobParameters parameters) {
    if (kind.isDiscovery()) {
      String location = parameters.getString(JobParameters.TARGET_LOCATION);
      if (location == null || location.isBlank()) {
        throw new IllegalArgumentException(
            kind.value() + " jobs require a non-blank " + JobParameters.TARGET_LOCATION);
      }
      parameters.getString(JobParameters.TARGET_INDUSTRY);
    } else {
      List<Long> ids = parameters.getLongList(JobParameters.BUSINESS_IDS);
      if (ids != null && ids.isEmpty()) {
        throw new IllegalArgumentException(
            JobParameters.BUSINESS_IDS + " must not be empty when given");
      }
    }
  }

  static String describe(JobKind kind, JobParameters parameters) {
    return switch (kind) {
      case DISCOVER_GOOGLE_MAPS, DISCOVER_LINKEDIN, DISCOVER_FACEBOOK,
          DISCOVER_CHAMBER_OF_COMMERCE -> {
        String industry = parameters.getString(JobParameters.TARGET_INDUSTRY);
        String location = parameters.getString(JobParameters.TARGET_LOCATION);
        yield industry == null
            ? "%s - %s".formatted(kind.sourceName(), location)
            : "%s - %s - %s".formatted(kind.sourceName(), location, industry);
      }
      case CHECK_WEBSITE -> {
        List<Long> ids = parameters.getLongList(JobParameters.BUSINESS_IDS);
        yield ids == null
            ? "Website check - unchecked businesses"
            : "Website check - %d businesses".formatted(ids.size());
      }
      case ENRICH_DATA -> {
        List<Long> ids = parameters.getLongList(JobParameters.BUSINESS_IDS);
        yield ids == null
            ? "Data enrichment - unprocessed businesses"
            : "Data enrichment - %d businesses".formatted(ids.size());
      }
    };
  }
}
