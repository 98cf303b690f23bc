package dev.zzpscanner.business;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A business in the catalog, typically a self-employed professional (ZZP).
 *
 * <p>Besides descriptive and contact fields, each business caches the outcome of its most recent
 * website check ({@link #getWebsiteExists()}, {@link #getWebsiteConfidenceScore()}, {@link
 * #getLastChecked()}). Those fields are overwritten by every check and are not recomputed from the
 * check history.
 *
 * <p>The {@code (source, sourceId)} pair identifies at most one business; discovery uses it to skip
 * candidates it already knows. Both confidence scores are clamped to [0.0, 1.0] on every write.
 *
 * <p>Maps to the {@code businesses} table managed by Flyway migrations.
 */
@Entity
@Table(name = "businesses")
public class Business {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  private UUID uuid;

  @Column(nullable = false)
  private String name;

  @Column(columnDefinition = "text")
  private String address;

  private String city;

  private String country;

  @Column(name = "postal_code")
  private String postalCode;

  private String phone;

  private String email;

  @Column(name = "website_exists")
  private Boolean websiteExists;

  @Column(name = "website_url")
  private String websiteUrl;

  @Column(name = "website_confidence_score", nullable = false)
  private double websiteConfidenceScore;

  @Column(name = "business_type")
  private String businessType;

  private String industry;

  @Column(name = "employee_count")
  private String employeeCount;

  @Column(name = "is_zzp", nullable = false)
  private boolean selfEmployed = true;

  private String source;

  @Column(name = "source_id")
  private String sourceId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "raw_data", columnDefinition = "jsonb")
  private Map<String, Object> rawData;

  @Column(name = "confidence_score", nullable = false)
  private double confidenceScore;

  @Column(name = "is_processed", nullable = false)
  private boolean processed;

  @Column(name = "is_verified", nullable = false)
  private boolean verified;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "last_checked")
  private Instant lastChecked;

  protected Business() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new self-employed business with no website information yet.
   *
   * @param name the trading name, used to derive candidate website domains
   */
  public Business(String name) {
    this.uuid = UUID.randomUUID();
    this.name = name;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /**
   * Overwrites the cached website fields with the outcome of a completed check.
   *
   * <p>The URL is only replaced when a website was found; a negative or errored outcome keeps the
   * previous URL but still flips the existence flag and confidence.
   *
   * @param exists whether a website was found
   * @param url the URL that answered, or null when none did
   * @param confidence confidence in the outcome, clamped to [0, 1]
   * @param checkedAt when the check completed
   */
  public void recordWebsiteCheck(
      boolean exists, @Nullable String url, double confidence, Instant checkedAt) {
    this.websiteExists = exists;
    this.websiteConfidenceScore = clamp(confidence);
    this.lastChecked = checkedAt;
    if (exists && url != null) {
      this.websiteUrl = url;
    }
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  public Long getId() {
    return id;
  }

  public UUID getUuid() {
    return uuid;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getAddress() {
    return address;
  }

  public void setAddress(String address) {
    this.address = address;
  }

  public String getCity() {
    return city;
  }

  public void setCity(String city) {
    this.city = city;
  }

  public String getCountry() {
    return country;
  }

  public void setCountry(String country) {
    this.country = country;
  }

  public String getPostalCode() {
    return postalCode;
  }

  public void setPostalCode(String postalCode) {
    this.postalCode = postalCode;
  }

  public String getPhone() {
    return phone;
  }

  public void setPhone(String phone) {
    this.phone = phone;
  }

  public String getEmail() {
    return email;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public Boolean getWebsiteExists() {
    return websiteExists;
  }

  public void setWebsiteExists(Boolean websiteExists) {
    this.websiteExists = websiteExists;
  }

  public String getWebsiteUrl() {
    return websiteUrl;
  }

  public void setWebsiteUrl(String websiteUrl) {
    this.websiteUrl = websiteUrl;
  }

  public double getWebsiteConfidenceScore() {
    return websiteConfidenceScore;
  }

  public void setWebsiteConfidenceScore(double websiteConfidenceScore) {
    this.websiteConfidenceScore = clamp(websiteConfidenceScore);
  }

  public String getBusinessType() {
    return businessType;
  }

  public void setBusinessType(String businessType) {
    this.businessType = businessType;
  }

  public String getIndustry() {
    return industry;
  }

  public void setIndustry(String industry) {
    this.industry = industry;
  }

  public String getEmployeeCount() {
    return employeeCount;
  }

  public void setEmployeeCount(String employeeCount) {
    this.employeeCount = employeeCount;
  }

  public boolean isSelfEmployed() {
    return selfEmployed;
  }

  public void setSelfEmployed(boolean selfEmployed) {
    this.selfEmployed = selfEmployed;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public String getSourceId() {
    return sourceId;
  }

  public void setSourceId(String sourceId) {
    this.sourceId = sourceId;
  }

  public Map<String, Object> getRawData() {
    return rawData;
  }

  public void setRawData(Map<String, Object> rawData) {
    this.rawData = rawData;
  }

  public double getConfidenceScore() {
    return confidenceScore;
  }

  public void setConfidenceScore(double confidenceScore) {
    this.confidenceScore = clamp(confidenceScore);
  }

  public boolean isProcessed() {
    return processed;
  }

  public void setProcessed(boolean processed) {
    this.processed = processed;
  }

  public boolean isVerified() {
    return verified;
  }

  public void setVerified(boolean verified) {
    this.verified = verified;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getLastChecked() {
    return lastChecked;
  }
}
