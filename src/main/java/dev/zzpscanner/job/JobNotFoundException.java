package dev.zzpscanner.job;

import java.util.NoSuchElementException;

/** Thrown when a job id does not exist. */
public class JobNotFoundException extends NoSuchElementException {

  public JobNotFoundException(long jobId) {
    super("Job not found: " + jobId);
  }
}
