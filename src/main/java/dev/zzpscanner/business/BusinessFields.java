package dev.zzpscanner.business;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Writable business fields accepted by create and update. On update only non-null fields are
 * applied; on create {@code name} is required.
 */
public record BusinessFields(
    @Nullable @Size(max = 255) String name,
    @Nullable String address,
    @Nullable @Size(max = 100) String city,
    @Nullable @Size(max = 100) String country,
    @Nullable @Size(max = 20) String postalCode,
    @Nullable @Size(max = 50) String phone,
    @Nullable @Email String email,
    @Nullable Boolean websiteExists,
    @Nullable @Size(max = 500) String websiteUrl,
    @Nullable @Size(max = 100) String businessType,
    @Nullable @Size(max = 100) String industry,
    @Nullable @Size(max = 50) String employeeCount,
    @Nullable Boolean isZzp,
    @Nullable @Size(max = 50) String source,
    @Nullable @Size(max = 255) String sourceId,
    @Nullable Map<String, Object> rawData,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double confidenceScore,
    @Nullable Boolean isVerified) {

  void applyTo(Business business) {
    if (name != null) {
      if (name.isBlank()) {
        throw new IllegalArgumentException("name must not be blank");
      }
      business.setName(name.trim());
    }
    if (address != null) {
      business.setAddress(address);
    }
    if (city != null) {
      business.setCity(city);
    }
    if (country != null) {
      business.setCountry(country);
    }
    if (postalCode != null) {
      business.setPostalCode(postalCode);
    }
    if (phone != null) {
      business.setPhone(phone);
    }
    if (email != null) {
      business.setEmail(email);
    }
    if (websiteExists != null) {
      business.setWebsiteExists(websiteExists);
    }
    if (websiteUrl != null) {
      business.setWebsiteUrl(websiteUrl);
    }
    if (businessType != null) {
      business.setBusinessType(businessType);
    }
    if (industry != null) {
      business.setIndustry(industry);
    }
    if (employeeCount != null) {
      business.setEmployeeCount(employeeCount);
    }
    if (isZzp != null) {
      business.setSelfEmployed(isZzp);
    }
    if (source != null) {
      business.setSource(source);
    }
    if (sourceId != null) {
      business.setSourceId(sourceId);
    }
    if (rawData != null) {
      business.setRawData(rawData);
    }
    if (confidenceScore != null) {
      business.setConfidenceScore(confidenceScore);
    }
    if (isVerified != null) {
      business.setVerified(isVerified);
    }
  }
}
