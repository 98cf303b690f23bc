package dev.zzpscanner.website;

import dev.zzpscanner.business.Business;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One website-existence check of a business, kept as history.
 *
 * <p>Belongs to exactly one {@link Business}; the foreign key cascades on delete, so removing a
 * business removes its checks. Diagnostic payloads (DNS, WHOIS, TLS, headers) are stored as opaque
 * JSON objects.
 */
@Entity
@Table(name = "website_checks")
public class WebsiteCheck {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "business_id", nullable = false, updatable = false)
  private Business business;

  @Column(name = "business_id", insertable = false, updatable = false)
  private Long businessId;

  @Column(name = "check_type", nullable = false)
  private String checkType;

  @Column(name = "url_checked")
  private String urlChecked;

  @Column(name = "website_exists", nullable = false)
  private boolean websiteExists;

  @Column(name = "confidence_score", nullable = false)
  private double confidenceScore;

  @Column(name = "status_code")
  private Integer statusCode;

  @Column(name = "response_time")
  private Double responseTime;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "dns_records", columnDefinition = "jsonb")
  private Map<String, Object> dnsRecords;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "whois_data", columnDefinition = "jsonb")
  private Map<String, Object> whoisData;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "ssl_info", columnDefinition = "jsonb")
  private Map<String, Object> sslInfo;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "jsonb")
  private Map<String, Object> headers;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  @Column(name = "is_error", nullable = false)
  private boolean error;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "checked_at", nullable = false)
  private Instant checkedAt;

  protected WebsiteCheck() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a check row from a probe outcome.
   *
   * @param business the checked business
   * @param checkType label such as {@code combined} or {@code single}
   * @param outcome what the probe found
   * @param checkedAt when the check finished
   */
  public WebsiteCheck(
      Business business, String checkType, WebsiteCheckOutcome outcome, Instant checkedAt) {
    this.business = business;
    this.businessId = business.getId();
    this.checkType = checkType;
    this.urlChecked = outcome.urlChecked();
    this.websiteExists = outcome.websiteExists();
    this.confidenceScore = outcome.confidenceScore();
    this.statusCode = outcome.statusCode();
    this.responseTime = outcome.responseTimeSeconds();
    this.dnsRecords = outcome.dnsRecords();
    this.headers = outcome.headers();
    this.errorMessage = outcome.errorMessage();
    this.error = outcome.error();
    this.createdAt = checkedAt;
    this.checkedAt = checkedAt;
  }

  public Long getId() {
    return id;
  }

  public Long getBusinessId() {
    return businessId;
  }

  public String getCheckType() {
    return checkType;
  }

  public String getUrlChecked() {
    return urlChecked;
  }

  public boolean isWebsiteExists() {
    return websiteExists;
  }

  public double getConfidenceScore() {
    return confidenceScore;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  public Double getResponseTime() {
    return responseTime;
  }

  public Map<String, Object> getDnsRecords() {
    return dnsRecords;
  }

  public Map<String, Object> getWhoisData() {
    return whoisData;
  }

  public Map<String, Object> getSslInfo() {
    return sslInfo;
  }

  public Map<String, Object> getHeaders() {
    return headers;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public boolean isError() {
    return error;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCheckedAt() {
    return checkedAt;
  }
}
