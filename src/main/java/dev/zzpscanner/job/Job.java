package dev.zzpscanner.job;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A unit of background work: discovering businesses, checking their websites or enriching them.
 *
 * <p>The lifecycle follows {@link JobStatus}. All transitions go through {@link JobTransitions};
 * this entity only holds state. Counters are exposed as a validated {@link JobCounters} snapshot so
 * an invalid combination can never be written.
 *
 * <p>Maps to the {@code crawl_jobs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "crawl_jobs")
public class Job {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  private UUID uuid;

  @Column(nullable = false)
  private String name;

  @Convert(converter = JobKindConverter.class)
  @Column(name = "job_type", nullable = false, updatable = false)
  private JobKind kind;

  @Convert(converter = JobStatusConverter.class)
  @Column(nullable = false)
  private JobStatus status = JobStatus.PENDING;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "jsonb")
  private Map<String, Object> parameters;

  @Column(name = "target_location")
  private String targetLocation;

  @Column(name = "target_industry")
  private String targetIndustry;

  @Column(name = "total_items", nullable = false)
  private int totalItems;

  @Column(name = "processed_items", nullable = false)
  private int processedItems;

  @Column(name = "successful_items", nullable = false)
  private int successfulItems;

  @Column(name = "failed_items", nullable = false)
  private int failedItems;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  @Column(name = "retry_count", nullable = false)
  private int retryCount;

  @Column(name = "max_retries", nullable = false)
  private int maxRetries;

  @Column(name = "task_handle")
  private String taskHandle;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  protected Job() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new job in {@link JobStatus#PENDING} state with zeroed counters.
   *
   * @param name a human-readable label
   * @param kind what the job does
   * @param parameters kind-specific input
   * @param maxRetries how many times a failed run may be retried
   */
  public Job(String name, JobKind kind, JobParameters parameters, int maxRetries) {
    this.uuid = UUID.randomUUID();
    this.name = name;
    this.kind = kind;
    this.parameters = new LinkedHashMap<>(parameters.asMap());
    this.targetLocation = parameters.getString(JobParameters.TARGET_LOCATION);
    this.targetIndustry = parameters.getString(JobParameters.TARGET_INDUSTRY);
    this.maxRetries = maxRetries;
  }

  @PrePersist
  protected void onCreate() {
    if (this.createdAt == null) {
      this.createdAt = Instant.now();
    }
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Failed with retries left. */
  public boolean canRetry() {
    return status == JobStatus.FAILED && retryCount < maxRetries;
  }

  public Long getId() {
    return id;
  }

  public UUID getUuid() {
    return uuid;
  }

  public String getName() {
    return name;
  }

  public JobKind getKind() {
    return kind;
  }

  public JobStatus getStatus() {
    return status;
  }

  void setStatus(JobStatus status) {
    this.status = status;
  }

  public JobParameters getParameters() {
    return JobParameters.of(parameters);
  }

  public String getTargetLocation() {
    return targetLocation;
  }

  public String getTargetIndustry() {
    return targetIndustry;
  }

  public JobCounters getCounters() {
    return new JobCounters(totalItems, processedItems, successfulItems, failedItems);
  }

  void setCounters(JobCounters counters) {
    this.totalItems = counters.total();
    this.processedItems = counters.processed();
    this.successfulItems = counters.successful();
    this.failedItems = counters.failed();
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public int getRetryCount() {
    return retryCount;
  }

  void setRetryCount(int retryCount) {
    this.retryCount = retryCount;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public String getTaskHandle() {
    return taskHandle;
  }

  void setTaskHandle(String taskHandle) {
    this.taskHandle = taskHandle;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  void setCompletedAt(Instant completedAt) {
    this.completedAt = completedAt;
  }
}
