package dev.zzpscanner.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Request bodies of the job endpoints. */
final class JobRequests {

  private JobRequests() {}

  /**
   * Starts a discovery job.
   *
   * @param kind a {@code discover-*} job kind, defaults to {@code discover-google-maps}
   */
  record Discover(
      @Nullable String kind,
      @NotBlank @Size(max = 255) String location,
      @Nullable @Size(max = 100) String industry) {}

  /**
   * Targets specific businesses, or the default selection of the job kind when ids are absent.
   */
  record BusinessIds(@Nullable List<Long> businessIds) {}
}
