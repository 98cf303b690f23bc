package dev.zzpscanner.api;

import dev.zzpscanner.website.WebsiteCheck;
import java.time.Instant;
import java.util.Map;

/** JSON view of a {@link WebsiteCheck}. */
record WebsiteCheckResponse(
    Long id,
    Long businessId,
    String checkType,
    String urlChecked,
    boolean websiteExists,
    double confidenceScore,
    Integer statusCode,
    Double responseTime,
    Map<String, Object> dnsRecords,
    Map<String, Object> whoisData,
    Map<String, Object> sslInfo,
    Map<String, Object> headers,
    String errorMessage,
    boolean isError,
    Instant createdAt,
    Instant checkedAt) {

  static WebsiteCheckResponse from(WebsiteCheck check) {
    return new WebsiteCheckResponse(
        check.getId(),
        check.getBusinessId(),
        check.getCheckType(),
        check.getUrlChecked(),
        check.isWebsiteExists(),
        check.getConfidenceScore(),
        check.getStatusCode(),
        check.getResponseTime(),
        check.getDnsRecords(),
        check.getWhoisData(),
        check.getSslInfo(),
        check.getHeaders(),
        check.getErrorMessage(),
        check.isError(),
        check.getCreatedAt(),
        check.getCheckedAt());
  }
}
