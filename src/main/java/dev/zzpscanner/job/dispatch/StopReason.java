package dev.zzpscanner.job.dispatch;

/** Why a running task was asked to stop. */
public enum StopReason {
  /** The job was cancelled by a caller. */
  CANCELLED,
  /** The task ran past the dispatcher's time limit. */
  TIMED_OUT,
  /** The worker thread was interrupted for another reason, typically pool shutdown. */
  INTERRUPTED
}
