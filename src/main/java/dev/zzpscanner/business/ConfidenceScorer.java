package dev.zzpscanner.business;

/**
 * Pure static utility computing a business's overall data-quality confidence.
 *
 * <p>Each populated field contributes a fixed weight: name 0.3, city 0.2, phone 0.15, email 0.15,
 * country 0.1, address 0.1, known website status 0.1, website URL 0.1, business type 0.05 and
 * industry 0.05. The sum is capped at 1.0.
 */
public final class ConfidenceScorer {

  private ConfidenceScorer() {}

  /**
   * Scores the completeness of a business record.
   *
   * @param business the business to score
   * @return confidence in [0.0, 1.0]
   */
  public static double score(Business business) {
    double score = 0.0;
    score += present(business.getName()) ? 0.3 : 0.0;
    score += present(business.getCity()) ? 0.2 : 0.0;
    score += present(business.getCountry()) ? 0.1 : 0.0;
    score += present(business.getPhone()) ? 0.15 : 0.0;
    score += present(business.getEmail()) ? 0.15 : 0.0;
    score += present(business.getAddress()) ? 0.1 : 0.0;
    score += business.getWebsiteExists() != null ? 0.1 : 0.0;
    score += present(business.getWebsiteUrl()) ? 0.1 : 0.0;
    score += present(business.getBusinessType()) ? 0.05 : 0.0;
    score += present(business.getIndustry()) ? 0.05 : 0.0;
    // 0.1 + 0.2 + ... accumulates floating point noise; round to 2 decimals before capping
    return Math.min(1.0, Math.round(score * 100.0) / 100.0);
  }

  private static boolean present(String value) {
    return value != null && !value.isBlank();
  }
}
