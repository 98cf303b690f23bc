package dev.zzpscanner.job.dispatch;

import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobParameters;
import java.util.Set;

/** Performs the per-item work of one or more job kinds on a dispatcher worker thread. */
public interface JobExecutor {

  /** Job kinds this executor handles. Each kind must be claimed by exactly one executor. */
  Set<JobKind> kinds();

  /**
   * Runs the job to completion, reporting start, progress and outcome to the lifecycle manager.
   * Implementations poll {@link TaskContext#isStopRequested()} between items.
   */
  void execute(long jobId, JobParameters parameters, TaskContext context);
}
