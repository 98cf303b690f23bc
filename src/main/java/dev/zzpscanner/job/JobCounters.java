package dev.zzpscanner.job;

/**
 * Progress and outcome counters of a job.
 *
 * <p>Every instance satisfies {@code 0 <= processed <= total} and {@code successful + failed <=
 * processed}; items that were processed without being counted as either (for example a discovered
 * business that was already in the catalog) make up the difference.
 *
 * @param total number of items the job will attempt
 * @param processed number of items handled so far
 * @param successful items handled with a positive result
 * @param failed items whose handling raised an error
 */
public record JobCounters(int total, int processed, int successful, int failed) {

  public static final JobCounters ZERO = new JobCounters(0, 0, 0, 0);

  /** Compact constructor validating the counter invariants. */
  public JobCounters {
    if (total < 0 || processed < 0 || successful < 0 || failed < 0) {
      throw new IllegalArgumentException(
          "Job counters must not be negative: " + describe(total, processed, successful, failed));
    }
    if (processed > total) {
      throw new IllegalArgumentException(
          "processed must not exceed total: " + describe(total, processed, successful, failed));
    }
    if (successful + failed > processed) {
      throw new IllegalArgumentException(
          "successful + failed must not exceed processed: "
              + describe(total, processed, successful, failed));
    }
  }

  /** Items processed without being counted successful or failed. */
  public int skipped() {
    return processed - successful - failed;
  }

  private static String describe(int total, int processed, int successful, int failed) {
    return "total=%d processed=%d successful=%d failed=%d"
        .formatted(total, processed, successful, failed);
  }
}
