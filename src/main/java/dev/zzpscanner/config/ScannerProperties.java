package dev.zzpscanner.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for jobs, probing and catalog maintenance.
 *
 * <p>Properties are bound from {@code scanner.*} in application.yml. A single instance is created
 * at startup and injected into every component that needs a limit, timeout or default; nothing
 * reads settings from a global.
 *
 * <ul>
 *   <li>{@code target-countries} - countries the catalog covers; the first is the default for
 *       discovery locations without a country part
 *   <li>{@code jobs.max-retries} - retries allowed per failed job (default 3)
 *   <li>{@code jobs.worker-threads} - size of the job worker pool (default 4)
 *   <li>{@code jobs.task-time-limit} - watchdog limit per dispatched task (default 30m)
 *   <li>{@code crawl.delay} - pause between discovery candidates (default 100ms)
 *   <li>{@code website-check.*} - batch ceiling, pacing, HTTP timeout, user agent and TLD order
 *   <li>{@code enrichment.batch-ceiling} - businesses per enrichment run (default 100)
 *   <li>{@code export.max-rows} - CSV export cap (default 10000)
 *   <li>{@code maintenance.retention-days} - default cleanup horizon (default 90)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {

  private List<String> targetCountries =
      new ArrayList<>(List.of("Netherlands", "Belgium", "Germany", "Luxembourg"));
  private final Jobs jobs = new Jobs();
  private final Crawl crawl = new Crawl();
  private final WebsiteCheck websiteCheck = new WebsiteCheck();
  private final Enrichment enrichment = new Enrichment();
  private final Export export = new Export();
  private final Maintenance maintenance = new Maintenance();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (targetCountries == null || targetCountries.isEmpty()) {
      throw new IllegalStateException("scanner.target-countries must not be empty");
    }
    if (jobs.maxRetries < 0) {
      throw new IllegalStateException(
          "scanner.jobs.max-retries must be >= 0, got: " + jobs.maxRetries);
    }
    if (jobs.workerThreads < 1) {
      throw new IllegalStateException(
          "scanner.jobs.worker-threads must be >= 1, got: " + jobs.workerThreads);
    }
    requirePositive("scanner.jobs.task-time-limit", jobs.taskTimeLimit);
    requireNotNegative("scanner.crawl.delay", crawl.delay);
    requireNotNegative("scanner.website-check.pacing", websiteCheck.pacing);
    requirePositive("scanner.website-check.request-timeout", websiteCheck.requestTimeout);
    if (websiteCheck.batchCeiling < 1 || websiteCheck.batchCeiling > 1000) {
      throw new IllegalStateException(
          "scanner.website-check.batch-ceiling must be in [1, 1000], got: "
              + websiteCheck.batchCeiling);
    }
    if (websiteCheck.tlds.isEmpty()) {
      throw new IllegalStateException("scanner.website-check.tlds must not be empty");
    }
    if (enrichment.batchCeiling < 1) {
      throw new IllegalStateException(
          "scanner.enrichment.batch-ceiling must be >= 1, got: " + enrichment.batchCeiling);
    }
    if (export.maxRows < 1) {
      throw new IllegalStateException(
          "scanner.export.max-rows must be >= 1, got: " + export.maxRows);
    }
    if (maintenance.retentionDays < 1) {
      throw new IllegalStateException(
          "scanner.maintenance.retention-days must be >= 1, got: " + maintenance.retentionDays);
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalStateException(name + " must be positive, got: " + value);
    }
  }

  private static void requireNotNegative(String name, Duration value) {
    if (value == null || value.isNegative()) {
      throw new IllegalStateException(name + " must not be negative, got: " + value);
    }
  }

  public List<String> getTargetCountries() {
    return targetCountries;
  }

  public void setTargetCountries(List<String> targetCountries) {
    this.targetCountries = targetCountries;
  }

  public Jobs getJobs() {
    return jobs;
  }

  public Crawl getCrawl() {
    return crawl;
  }

  public WebsiteCheck getWebsiteCheck() {
    return websiteCheck;
  }

  public Enrichment getEnrichment() {
    return enrichment;
  }

  public Export getExport() {
    return export;
  }

  public Maintenance getMaintenance() {
    return maintenance;
  }

  public static class Jobs {
    private int maxRetries = 3;
    private int workerThreads = 4;
    private Duration taskTimeLimit = Duration.ofMinutes(30);

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public int getWorkerThreads() {
      return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
    }

    public Duration getTaskTimeLimit() {
      return taskTimeLimit;
    }

    public void setTaskTimeLimit(Duration taskTimeLimit) {
      this.taskTimeLimit = taskTimeLimit;
    }
  }

  public static class Crawl {
    private Duration delay = Duration.ofMillis(100);

    public Duration getDelay() {
      return delay;
    }

    public void setDelay(Duration delay) {
      this.delay = delay;
    }
  }

  public static class WebsiteCheck {
    private int batchCeiling = 100;
    private Duration pacing = Duration.ofMillis(500);
    private Duration requestTimeout = Duration.ofSeconds(10);
    private String userAgent = "Mozilla/5.0 (compatible; ZZP-Scanner/1.0)";
    private List<String> tlds = new ArrayList<>(List.of("nl", "com", "be", "de", "lu"));

    public int getBatchCeiling() {
      return batchCeiling;
    }

    public void setBatchCeiling(int batchCeiling) {
      this.batchCeiling = batchCeiling;
    }

    public Duration getPacing() {
      return pacing;
    }

    public void setPacing(Duration pacing) {
      this.pacing = pacing;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(String userAgent) {
      this.userAgent = userAgent;
    }

    public List<String> getTlds() {
      return tlds;
    }

    public void setTlds(List<String> tlds) {
      this.tlds = tlds;
    }
  }

  public static class Enrichment {
    private int batchCeiling = 100;

    public int getBatchCeiling() {
      return batchCeiling;
    }

    public void setBatchCeiling(int batchCeiling) {
      this.batchCeiling = batchCeiling;
    }
  }

  public static class Export {
    private int maxRows = 10_000;

    public int getMaxRows() {
      return maxRows;
    }

    public void setMaxRows(int maxRows) {
      this.maxRows = maxRows;
    }
  }

  public static class Maintenance {
    private int retentionDays = 90;

    public int getRetentionDays() {
      return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
    }
  }
}
