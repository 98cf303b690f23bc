package dev.zzpscanner.job;

import java.time.Duration;
import java.time.Instant;

/** Polls a job until the worker pool has finished with it. */
public final class JobAwait {

  private JobAwait() {}

  public static Job terminal(JobLifecycleManager lifecycle, long jobId)
      throws InterruptedException {
    Instant deadline = Instant.now().plus(Duration.ofSeconds(20));
    Job job = lifecycle.getJob(jobId);
    while (!job.getStatus().isTerminal()) {
      if (Instant.now().isAfter(deadline)) {
        throw new AssertionError("Job " + jobId + " still " + job.getStatus().value());
      }
      Thread.sleep(50);
      job = lifecycle.getJob(jobId);
    }
    return job;
  }
}
