package dev.zzpscanner.job.dispatch;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;

/**
 * Cooperative stop signal shared between a dispatched task and whoever may stop it.
 *
 * <p>The first stop request wins; later requests keep the original reason.
 */
public final class TaskContext {

  private final String taskId;
  private final long jobId;
  private final AtomicReference<StopReason> stopReason = new AtomicReference<>();

  public TaskContext(String taskId, long jobId) {
    this.taskId = taskId;
    this.jobId = jobId;
  }

  /** A context that is never stopped by anyone else, for synchronous runs and tests. */
  public static TaskContext detached(long jobId) {
    return new TaskContext("detached-" + jobId, jobId);
  }

  public String taskId() {
    return taskId;
  }

  public long jobId() {
    return jobId;
  }

  public void requestStop(StopReason reason) {
    stopReason.compareAndSet(null, reason);
  }

  public boolean isStopRequested() {
    return stopReason.get() != null;
  }

  public @Nullable StopReason stopReason() {
    return stopReason.get();
  }

  /**
   * Sleeps between items. An interrupt restores the interrupt flag and records a stop request.
   *
   * @param delay pause length, zero to only check the stop flag
   * @return true if the caller should continue with the next item
   */
  public boolean pause(Duration delay) {
    if (isStopRequested()) {
      return false;
    }
    if (delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      requestStop(StopReason.INTERRUPTED);
    }
    return !isStopRequested();
  }
}
