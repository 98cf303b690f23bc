package dev.zzpscanner.job;

/**
 * Thrown when a requested transition is not legal from the job's current state. The job is left
 * unchanged.
 */
public class InvalidJobStateException extends IllegalStateException {

  private final long jobId;
  private final JobStatus status;

  public InvalidJobStateException(long jobId, JobStatus status, String message) {
    super("Job %d is %s: %s".formatted(jobId, status.value(), message));
    this.jobId = jobId;
    this.status = status;
  }

  public long getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
