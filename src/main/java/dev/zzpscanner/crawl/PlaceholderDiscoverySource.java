package dev.zzpscanner.crawl;

import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.JobKind;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for the real directory integrations (Google Maps, LinkedIn, Facebook,
 * Chamber of Commerce). Produces two example businesses per location. A location without a
 * country part is placed in the first of {@code scanner.target-countries}.
 *
 * <p>Source ids are derived from the kind and the location only, so running the same discovery
 * twice yields the same ids and the second run adds nothing. The data is not real.
 */
@Component
public class PlaceholderDiscoverySource implements DiscoverySource {

  private final String defaultCountry;

  public PlaceholderDiscoverySource(ScannerProperties properties) {
    this.defaultCountry = properties.getTargetCountries().get(0);
  }

  @Override
  public Set<JobKind> kinds() {
    return EnumSet.of(
        JobKind.DISCOVER_GOOGLE_MAPS,
        JobKind.DISCOVER_LINKEDIN,
        JobKind.DISCOVER_FACEBOOK,
        JobKind.DISCOVER_CHAMBER_OF_COMMERCE);
  }

  @Override
  public List<DiscoveredBusiness> discover(
      JobKind kind, String location, @Nullable String industry) {
    String city = cityOf(location);
    String country = countryOf(location, defaultCountry);
    String source = kind.sourceName();
    String slug = slug(location);
    return List.of(
        new DiscoveredBusiness(
            "Test Business 1 - " + location,
            city,
            country,
            "+31 6 12345678",
            "info@testbusiness1.nl",
            "Webdesign",
            industry != null ? industry : "Technology",
            null,
            null,
            0.8,
            source,
            idFor(source, 1, slug),
            raw(kind, location, industry)),
        new DiscoveredBusiness(
            "Test Business 2 - " + location,
            city,
            country,
            "+31 6 87654321",
            "info@testbusiness2.nl",
            "Marketing",
            industry != null ? industry : "Marketing",
            true,
            "https://testbusiness2.nl",
            0.9,
            source,
            idFor(source, 2, slug),
            raw(kind, location, industry)));
  }

  /** Text before the first comma. */
  static String cityOf(String location) {
    int comma = location.indexOf(',');
    return (comma < 0 ? location : location.substring(0, comma)).trim();
  }

  /** Text after the last comma, or the default country when there is none. */
  static String countryOf(String location, String defaultCountry) {
    int comma = location.lastIndexOf(',');
    if (comma < 0) {
      return defaultCountry;
    }
    String country = location.substring(comma + 1).trim();
    return country.isEmpty() ? defaultCountry : country;
  }

  static String slug(String location) {
    String slug = location.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    return slug.replaceAll("^-+|-+$", "");
  }

  private static String idFor(String source, int index, String slug) {
    String prefix =
        switch (source) {
          case "google_maps" -> "gm";
          case "linkedin" -> "li";
          case "facebook" -> "fb";
          case "chamber_of_commerce" -> "kvk";
          default -> source;
        };
    return prefix + "_" + index + "_" + slug;
  }

  private static Map<String, Object> raw(JobKind kind, String location, @Nullable String industry) {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("generator", "placeholder");
    raw.put("job_kind", kind.value());
    raw.put("location", location);
    if (industry != null) {
      raw.put("industry", industry);
    }
    return raw;
  }
}
