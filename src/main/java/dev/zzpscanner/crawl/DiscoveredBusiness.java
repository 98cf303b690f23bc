package dev.zzpscanner.crawl;

import dev.zzpscanner.business.Business;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A business candidate produced by a {@link DiscoverySource}, not yet in the catalog.
 *
 * @param source provenance label, for example {@code google_maps}
 * @param sourceId identifier within the source; with {@code source} it identifies the business
 */
public record DiscoveredBusiness(
    String name,
    @Nullable String city,
    @Nullable String country,
    @Nullable String phone,
    @Nullable String email,
    @Nullable String businessType,
    @Nullable String industry,
    @Nullable Boolean websiteExists,
    @Nullable String websiteUrl,
    double confidenceScore,
    String source,
    String sourceId,
    Map<String, Object> rawData) {

  /** Compact constructor validating input. */
  public DiscoveredBusiness {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Discovered business needs a name");
    }
    if (source == null || source.isBlank() || sourceId == null || sourceId.isBlank()) {
      throw new IllegalArgumentException("Discovered business needs a source and source id");
    }
    rawData = rawData == null ? Map.of() : Map.copyOf(rawData);
  }

  Business toBusiness() {
    Business business = new Business(name);
    business.setCity(city);
    business.setCountry(country);
    business.setPhone(phone);
    business.setEmail(email);
    business.setBusinessType(businessType);
    business.setIndustry(industry);
    business.setWebsiteExists(websiteExists);
    business.setWebsiteUrl(websiteUrl);
    business.setConfidenceScore(confidenceScore);
    business.setSelfEmployed(true);
    business.setSource(source);
    business.setSourceId(sourceId);
    business.setRawData(rawData);
    return business;
  }
}
