package dev.zzpscanner.job.dispatch;

import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobParameters;

/**
 * Runs jobs asynchronously and lets callers request their termination.
 *
 * <p>The transport is an implementation choice: the shipped {@link ExecutorJobDispatcher} runs
 * tasks on an in-process worker pool.
 */
public interface JobDispatcher {

  /**
   * Hands a job to the executor registered for its kind.
   *
   * @param jobId the persisted job to run
   * @param kind selects the executor
   * @param parameters input passed to the executor unchanged
   * @return an opaque handle identifying the task, accepted by {@link #cancel(String)}
   * @throws IllegalArgumentException if no executor handles the kind
   */
  String startJob(long jobId, JobKind kind, JobParameters parameters);

  /**
   * Requests termination of a task. Unknown or already finished handles are ignored.
   *
   * @param taskHandle a handle returned by {@link #startJob}
   */
  void cancel(String taskHandle);
}
