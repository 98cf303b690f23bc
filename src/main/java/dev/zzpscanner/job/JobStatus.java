package dev.zzpscanner.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Lifecycle states of a {@link Job}.
 *
 * <pre>
 * PENDING ──► RUNNING ──► COMPLETED
 *    │           │
 *    │           └──────► FAILED ──(retry)──► PENDING
 *    └──────┬────┘
 *           ▼
 *       CANCELLED
 * </pre>
 *
 * <p>Persisted and serialized as the lowercase {@link #value()}.
 */
public enum JobStatus {
  PENDING("pending"),
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed"),
  CANCELLED("cancelled");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Completed, failed and cancelled jobs carry a completion timestamp. */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public boolean isCancellable() {
    return this == PENDING || this == RUNNING;
  }

  /**
   * Resolves a stored or requested status string.
   *
   * @throws IllegalArgumentException if the string names no status
   */
  public static JobStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
  }
}
