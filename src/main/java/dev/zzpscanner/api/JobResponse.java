package dev.zzpscanner.api;

import dev.zzpscanner.job.Job;
import dev.zzpscanner.job.JobCounters;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** JSON view of a {@link Job}, counters flattened. */
record JobResponse(
    Long id,
    UUID uuid,
    String name,
    String jobType,
    String status,
    Map<String, Object> parameters,
    String targetLocation,
    String targetIndustry,
    int totalItems,
    int processedItems,
    int successfulItems,
    int failedItems,
    String errorMessage,
    int retryCount,
    int maxRetries,
    boolean canRetry,
    String taskHandle,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt) {

  static JobResponse from(Job job) {
    JobCounters counters = job.getCounters();
    return new JobResponse(
        job.getId(),
        job.getUuid(),
        job.getName(),
        job.getKind().value(),
        job.getStatus().value(),
        job.getParameters().asMap(),
        job.getTargetLocation(),
        job.getTargetIndustry(),
        counters.total(),
        counters.processed(),
        counters.successful(),
        counters.failed(),
        job.getErrorMessage(),
        job.getRetryCount(),
        job.getMaxRetries(),
        job.canRetry(),
        job.getTaskHandle(),
        job.getCreatedAt(),
        job.getUpdatedAt(),
        job.getStartedAt(),
        job.getCompletedAt());
  }
}
