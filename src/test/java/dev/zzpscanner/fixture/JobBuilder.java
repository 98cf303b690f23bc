package dev.zzpscanner.fixture;

import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.JobStatus;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Test builder for the {@link Job} entity. Defaults to a pending discovery job for Amsterdam. */
public final class JobBuilder {

  private @Nullable Long id = 1L;
  private String name = "google_maps - Amsterdam";
  private JobKind kind = JobKind.DISCOVER_GOOGLE_MAPS;
  private JobParameters parameters = JobParameters.discovery("Amsterdam", null);
  private JobStatus status = JobStatus.PENDING;
  private JobCounters counters = JobCounters.ZERO;
  private int retryCount;
  private int maxRetries = 3;
  private @Nullable String taskHandle;
  private @Nullable String errorMessage;
  private @Nullable Instant createdAt = Instant.parse("2026-01-01T10:00:00Z");
  private @Nullable Instant startedAt;
  private @Nullable Instant completedAt;

  public JobBuilder id(@Nullable Long id) {
    this.id = id;
    return this;
  }

  public JobBuilder name(String name) {
    this.name = name;
    return this;
  }

  public JobBuilder kind(JobKind kind) {
    this.kind = kind;
    return this;
  }

  public JobBuilder parameters(JobParameters parameters) {
    this.parameters = parameters;
    return this;
  }

  public JobBuilder status(JobStatus status) {
    this.status = status;
    return this;
  }

  public JobBuilder counters(JobCounters counters) {
    this.counters = counters;
    return this;
  }

  public JobBuilder retryCount(int retryCount) {
    this.retryCount = retryCount;
    return this;
  }

  public JobBuilder maxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
    return this;
  }

  public JobBuilder taskHandle(@Nullable String taskHandle) {
    this.taskHandle = taskHandle;
    return this;
  }

  public JobBuilder errorMessage(@Nullable String errorMessage) {
    this.errorMessage = errorMessage;
    return this;
  }

  public JobBuilder createdAt(@Nullable Instant createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public JobBuilder startedAt(@Nullable Instant startedAt) {
    this.startedAt = startedAt;
    return this;
  }

  public JobBuilder completedAt(@Nullable Instant completedAt) {
    this.completedAt = completedAt;
    return this;
  }

  public Job build() {
    Job job = new Job(name, kind, parameters, maxRetries);
    EntityFields.set(job, "id", id);
    EntityFields.set(job, "status", status);
    EntityFields.set(job, "totalItems", counters.total());
    EntityFields.set(job, "processedItems", counters.processed());
    EntityFields.set(job, "successfulItems", counters.successful());
    EntityFields.set(job, "failedItems", counters.failed());
    EntityFields.set(job, "retryCount", retryCount);
    EntityFields.set(job, "taskHandle", taskHandle);
    EntityFields.set(job, "errorMessage", errorMessage);
    EntityFields.set(job, "createdAt", createdAt);
    EntityFields.set(job, "startedAt", startedAt);
    EntityFields.set(job, "completedAt", completedAt);
    return job;
  }
}
