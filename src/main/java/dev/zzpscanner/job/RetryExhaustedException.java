package dev.zzpscanner.job;

/** Thrown when a failed job has already used all of its retries. */
public class RetryExhaustedException extends InvalidJobStateException {

  public RetryExhaustedException(long jobId, int maxRetries) {
    super(jobId, JobStatus.FAILED, "retry limit of " + maxRetries + " reached");
  }
}
