package dev.zzpscanner.api;

import dev.zzpscanner.business.Business;
import java.time.Instant;
import java.util.UUID;

/** JSON view of a {@link Business}. */
record BusinessResponse(
    Long id,
    UUID uuid,
    String name,
    String address,
    String city,
    String country,
    String postalCode,
    String phone,
    String email,
    Boolean websiteExists,
    String websiteUrl,
    double websiteConfidenceScore,
    String businessType,
    String industry,
    String employeeCount,
    boolean isZzp,
    String source,
    String sourceId,
    double confidenceScore,
    boolean isProcessed,
    boolean isVerified,
    Instant createdAt,
    Instant updatedAt,
    Instant lastChecked) {

  static BusinessResponse from(Business business) {
    return new BusinessResponse(
        business.getId(),
        business.getUuid(),
        business.getName(),
        business.getAddress(),
        business.getCity(),
        business.getCountry(),
        business.getPostalCode(),
        business.getPhone(),
        business.getEmail(),
        business.getWebsiteExists(),
        business.getWebsiteUrl(),
        business.getWebsiteConfidenceScore(),
        business.getBusinessType(),
        business.getIndustry(),
        business.getEmployeeCount(),
        business.isSelfEmployed(),
        business.getSource(),
        business.getSourceId(),
        business.getConfidenceScore(),
        business.isProcessed(),
        business.isVerified(),
        business.getCreatedAt(),
        business.getUpdatedAt(),
        business.getLastChecked());
  }
}
