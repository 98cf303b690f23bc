package dev.zzpscanner.website;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Result of probing one business's candidate domains, ready to be stored as a {@link
 * WebsiteCheck} and copied into the business's cached website fields.
 *
 * @param websiteExists whether some candidate answered with a status below 400
 * @param confidenceScore 0.9 for a 200, 0.7 for another status below 400, otherwise 0.0
 * @param websiteUrl the URL that answered, null when none did
 * @param urlChecked the URL that answered, else the last one fetched, else the first candidate
 * @param statusCode status of the last response received
 * @param responseTimeSeconds elapsed time of the last response received
 * @param dnsRecords addresses of the last domain that resolved
 * @param headers headers of the last response received
 * @param errorMessage probe errors other than "not found", joined
 * @param error true when no website was found and at least one probe error occurred
 */
public record WebsiteCheckOutcome(
    boolean websiteExists,
    double confidenceScore,
    @Nullable String websiteUrl,
    @Nullable String urlChecked,
    @Nullable Integer statusCode,
    @Nullable Double responseTimeSeconds,
    @Nullable Map<String, Object> dnsRecords,
    @Nullable Map<String, Object> headers,
    @Nullable String errorMessage,
    boolean error) {

  /** Outcome recorded when checking a business threw before a result was available. */
  public static WebsiteCheckOutcome failed(String errorMessage) {
    return new WebsiteCheckOutcome(
        false, 0.0, null, null, null, null, null, null, errorMessage, true);
  }
}
