package dev.zzpscanner.job;

import dev.zzpscanner.job.dispatch.JobExecutor;
import dev.zzpscanner.job.dispatch.StopReason;
import dev.zzpscanner.job.dispatch.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Template for executors that walk a batch of items: start the job, run the batch, then report
 * completion or failure.
 *
 * <p>An exception escaping {@link #runBatch} fails the job with the exception message. A stop
 * requested by the dispatcher ends the batch early: after a cancellation the completion report is
 * dropped by the lifecycle manager, after a timeout or an interrupt the job is failed.
 */
public abstract class AbstractJobExecutor implements JobExecutor {

  private static final Logger log = LoggerFactory.getLogger(AbstractJobExecutor.class);

  protected final JobLifecycleManager lifecycle;

  protected AbstractJobExecutor(JobLifecycleManager lifecycle) {
    this.lifecycle = lifecycle;
  }

  @Override
  public final void execute(long jobId, JobParameters parameters, TaskContext context) {
    if (!lifecycle.start(jobId)) {
      return;
    }
    JobCounters counters;
    try {
      counters = runBatch(jobId, parameters, context);
    } catch (RuntimeException e) {
      StopReason stopReason = context.stopReason();
      if (stopReason == StopReason.TIMED_OUT || stopReason == StopReason.INTERRUPTED) {
        // the stop interrupted a call in flight; the last reported progress is what was done
        log.warn("Job {} stopped ({}) inside a batch step: {}", jobId, stopReason, e.toString());
        report(
            () ->
                lifecycle.fail(
                    jobId, stoppedMessage(stopReason, lifecycle.getJob(jobId).getCounters())));
      } else {
        log.error("Job {} aborted: {}", jobId, e.getMessage(), e);
        report(() -> lifecycle.fail(jobId, messageOf(e)));
      }
      return;
    }
    StopReason stopReason = context.stopReason();
    if (stopReason == StopReason.TIMED_OUT || stopReason == StopReason.INTERRUPTED) {
      report(() -> lifecycle.fail(jobId, stoppedMessage(stopReason, counters)));
    } else {
      report(() -> lifecycle.complete(jobId, counters));
    }
  }

  /**
   * Processes the job's items.
   *
   * @return final counters; when stopped early, counters of the items handled so far
   */
  protected abstract JobCounters runBatch(
      long jobId, JobParameters parameters, TaskContext context);

  /** Reports progress after an item, from the tally's point of view. */
  protected void reportProgress(long jobId, ItemTally tally) {
    lifecycle.reportProgress(jobId, tally.processed(), tally.total());
  }

  /**
   * Errors meaning the record store itself is unreachable. They end the whole batch instead of
   * failing a single item.
   */
  protected static boolean isBatchFatal(RuntimeException e) {
    return e instanceof DataAccessResourceFailureException
        || e instanceof CannotCreateTransactionException;
  }

  protected static String messageOf(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  private static String stoppedMessage(StopReason stopReason, JobCounters counters) {
    String progress = counters.processed() + " of " + counters.total() + " items";
    return stopReason == StopReason.TIMED_OUT
        ? "Task exceeded its time limit after " + progress
        : "Task interrupted after " + progress;
  }

  /**
   * Runs the final report with the interrupt flag cleared, so a cancelled or timed-out worker can
   * still reach the database, then restores the flag.
   */
  private static void report(Runnable step) {
    boolean interrupted = Thread.interrupted();
    try {
      step.run();
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
