package dev.zzpscanner.job.dispatch;

import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobParameters;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link JobDispatcher} running each job as one task on a fixed worker pool.
 *
 * <p>Running tasks are tracked in a {@link ConcurrentHashMap} keyed by task handle and removed when
 * the task ends, whatever the outcome. Cancelling raises the task's stop flag and interrupts the
 * worker. Once a task starts, a watchdog raises the stop flag with {@link StopReason#TIMED_OUT}
 * after {@code scanner.jobs.task-time-limit}; the executor then fails the job.
 *
 * <p>The worker thread carries the job id in the SLF4J MDC under {@value #MDC_JOB_ID}.
 */
@Component
public class ExecutorJobDispatcher implements JobDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ExecutorJobDispatcher.class);

  static final String MDC_JOB_ID = "jobId";

  private final Supplier<List<JobExecutor>> executorSource;
  private final ExecutorService workerPool;
  private final ScheduledExecutorService watchdog;
  private final Duration taskTimeLimit;
  private final ConcurrentHashMap<String, RunningTask> tasks = new ConcurrentHashMap<>();
  private volatile @Nullable Map<JobKind, JobExecutor> executors;

  /**
   * Executors are looked up on first dispatch: they depend on the lifecycle manager, which depends
   * on this dispatcher.
   */
  @Autowired
  public ExecutorJobDispatcher(
      ObjectProvider<JobExecutor> jobExecutors,
      @Qualifier("jobWorkerPool") ExecutorService workerPool,
      @Qualifier("jobWatchdog") ScheduledExecutorService watchdog,
      ScannerProperties properties) {
    this(() -> jobExecutors.orderedStream().toList(), workerPool, watchdog, properties);
  }

  ExecutorJobDispatcher(
      Supplier<List<JobExecutor>> executorSource,
      ExecutorService workerPool,
      ScheduledExecutorService watchdog,
      ScannerProperties properties) {
    this.executorSource = executorSource;
    this.workerPool = workerPool;
    this.watchdog = watchdog;
    this.taskTimeLimit = properties.getJobs().getTaskTimeLimit();
  }

  @Override
  public String startJob(long jobId, JobKind kind, JobParameters parameters) {
    JobExecutor executor = executorsByKind().get(kind);
    if (executor == null) {
      throw new IllegalArgumentException("No executor registered for job kind " + kind.value());
    }
    String taskId = UUID.randomUUID().toString();
    RunningTask task = new RunningTask(new TaskContext(taskId, jobId));
    tasks.put(taskId, task);
    try {
      if (task.attach(workerPool.submit(() -> run(task, executor, parameters)))) {
        tasks.remove(taskId);
      }
    } catch (RuntimeException e) {
      tasks.remove(taskId);
      throw e;
    }
    log.info("Dispatched job {} ({}) as task {}", jobId, kind.value(), taskId);
    return taskId;
  }

  @Override
  public void cancel(String taskHandle) {
    RunningTask task = tasks.get(taskHandle);
    if (task == null) {
      log.debug("Task {} already finished, nothing to cancel", taskHandle);
      return;
    }
    task.context.requestStop(StopReason.CANCELLED);
    if (task.cancel()) {
      // never started, so run() will not clean up after it
      tasks.remove(taskHandle);
    }
    log.info("Cancellation requested for job {} (task {})", task.context.jobId(), taskHandle);
  }

  private Map<JobKind, JobExecutor> executorsByKind() {
    Map<JobKind, JobExecutor> current = executors;
    if (current == null) {
      synchronized (this) {
        current = executors;
        if (current == null) {
          current = indexByKind(executorSource.get());
          executors = current;
        }
      }
    }
    return current;
  }

  private static Map<JobKind, JobExecutor> indexByKind(List<JobExecutor> jobExecutors) {
    Map<JobKind, JobExecutor> byKind = new EnumMap<>(JobKind.class);
    for (JobExecutor executor : jobExecutors) {
      for (JobKind kind : executor.kinds()) {
        JobExecutor previous = byKind.putIfAbsent(kind, executor);
        if (previous != null) {
          throw new IllegalStateException(
              "Job kind %s claimed by both %s and %s"
                  .formatted(
                      kind.value(),
                      previous.getClass().getSimpleName(),
                      executor.getClass().getSimpleName()));
        }
      }
    }
    return byKind;
  }

  /** Number of tasks queued or running. */
  int activeTasks() {
    return tasks.size();
  }

  private void run(RunningTask task, JobExecutor executor, JobParameters parameters) {
    TaskContext context = task.context;
    task.markStarted();
    ScheduledFuture<?> timeout =
        watchdog.schedule(
            () -> {
              log.warn(
                  "Job {} exceeded time limit {}, requesting stop", context.jobId(), taskTimeLimit);
              context.requestStop(StopReason.TIMED_OUT);
              task.cancel();
            },
            taskTimeLimit.toMillis(),
            TimeUnit.MILLISECONDS);
    MDC.put(MDC_JOB_ID, String.valueOf(context.jobId()));
    try {
      executor.execute(context.jobId(), parameters, context);
    } catch (RuntimeException e) {
      log.error("Executor for job {} ended with an unhandled error", context.jobId(), e);
    } finally {
      timeout.cancel(false);
      tasks.remove(context.taskId());
      MDC.remove(MDC_JOB_ID);
    }
  }

  private static final class RunningTask {

    private final TaskContext context;
    private @Nullable Future<?> future;
    private boolean started;
    private boolean cancelRequested;

    RunningTask(TaskContext context) {
      this.context = context;
    }

    /** Returns true if a cancellation arrived first and the task was withdrawn before running. */
    synchronized boolean attach(Future<?> future) {
      this.future = future;
      return cancelRequested && !started && future.cancel(false);
    }

    synchronized void markStarted() {
      started = true;
    }

    /**
     * Interrupts a started task, or withdraws a queued one.
     *
     * @return true if the task was withdrawn and will never run
     */
    synchronized boolean cancel() {
      cancelRequested = true;
      if (future == null) {
        return false;
      }
      if (started) {
        future.cancel(true);
        return false;
      }
      return future.cancel(false);
    }
  }
}
