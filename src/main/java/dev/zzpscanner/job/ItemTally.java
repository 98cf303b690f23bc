package dev.zzpscanner.job;

/**
 * Mutable per-run counter used by executors while they walk their items. Not thread-safe: one
 * tally belongs to one worker thread.
 */
public final class ItemTally {

  private final int total;
  private int processed;
  private int successful;
  private int failed;

  public ItemTally(int total) {
    if (total < 0) {
      throw new IllegalArgumentException("total must not be negative: " + total);
    }
    this.total = total;
  }

  public void success() {
    advance();
    successful++;
  }

  public void failure() {
    advance();
    failed++;
  }

  /** Processed without a positive or negative outcome, for example an already known record. */
  public void skip() {
    advance();
  }

  public int total() {
    return total;
  }

  public int processed() {
    return processed;
  }

  public JobCounters toCounters() {
    return new JobCounters(total, processed, successful, failed);
  }

  private void advance() {
    if (processed == total) {
      throw new IllegalStateException("All " + total + " items were already counted");
    }
    processed++;
  }
}
