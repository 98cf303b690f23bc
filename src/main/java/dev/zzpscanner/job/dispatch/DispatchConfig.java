package dev.zzpscanner.job.dispatch;

import dev.zzpscanner.config.ScannerProperties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Thread pools backing {@link ExecutorJobDispatcher}. */
@Configuration
public class DispatchConfig {

  @Bean(name = "jobWorkerPool", destroyMethod = "shutdownNow")
  public ExecutorService jobWorkerPool(ScannerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getJobs().getWorkerThreads(), namedThreads("job-worker-"));
  }

  @Bean(name = "jobWatchdog", destroyMethod = "shutdownNow")
  public ScheduledExecutorService jobWatchdog() {
    return Executors.newSingleThreadScheduledExecutor(namedThreads("job-watchdog-"));
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
