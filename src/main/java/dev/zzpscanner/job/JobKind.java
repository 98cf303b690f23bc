package dev.zzpscanner.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * The kind of background work a {@link Job} performs. Discovery kinds carry the name of the
 * source their businesses are attributed to.
 */
public enum JobKind {
  DISCOVER_GOOGLE_MAPS("discover-google-maps", "google_maps"),
  DISCOVER_LINKEDIN("discover-linkedin", "linkedin"),
  DISCOVER_FACEBOOK("discover-facebook", "facebook"),
  DISCOVER_CHAMBER_OF_COMMERCE("discover-chamber-of-commerce", "chamber_of_commerce"),
  CHECK_WEBSITE("check-website", null),
  ENRICH_DATA("enrich-data", null);

  private final String value;
  private final @Nullable String sourceName;

  JobKind(String value, @Nullable String sourceName) {
    this.value = value;
    this.sourceName = sourceName;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isDiscovery() {
    return sourceName != null;
  }

  /**
   * Returns the provenance label stamped on businesses found by this kind.
   *
   * @throws IllegalStateException if this is not a discovery kind
   */
  public String sourceName() {
    if (sourceName == null) {
      throw new IllegalStateException(value + " is not a discovery job kind");
    }
    return sourceName;
  }

  /**
   * Resolves a stored or requested kind string.
   *
   * @throws IllegalArgumentException if the string names no kind
   */
  @JsonCreator
  public static JobKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown job kind: " + value));
  }
}
