package dev.zzpscanner.website;

import java.time.Duration;
import java.util.Map;

/**
 * Response of a website fetch. Any status code is a result; only transport failures are errors.
 *
 * @param statusCode HTTP status of the final response
 * @param headers response headers, multiple values joined with a comma
 * @param elapsed time from request to response headers
 */
public record HttpProbeResult(int statusCode, Map<String, String> headers, Duration elapsed) {

  public HttpProbeResult {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /** Any status below 400 counts as a live website. */
  public boolean isReachable() {
    return statusCode < 400;
  }

  public double elapsedSeconds() {
    return elapsed.toNanos() / 1_000_000_000.0;
  }
}
