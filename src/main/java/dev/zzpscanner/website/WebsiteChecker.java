package dev.zzpscanner.website;

import dev.zzpscanner.config.ScannerProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a business has a website by probing its {@link CandidateDomains} in order.
 *
 * <p>For each candidate: resolve it, skip it if it does not exist, otherwise fetch {@code
 * https://<domain>}. The first status below 400 ends the search with confidence 0.9 (status 200)
 * or 0.7 (anything else). Probe errors are collected and the next candidate is tried. When no
 * candidate answers the outcome is negative with confidence 0.0, flagged as an error only if some
 * probe failed for a reason other than a missing domain.
 */
@Component
public class WebsiteChecker {

  private static final Logger log = LoggerFactory.getLogger(WebsiteChecker.class);

  static final double CONFIDENCE_OK = 0.9;
  static final double CONFIDENCE_REACHABLE = 0.7;

  private final WebsiteProbe probe;
  private final List<String> tlds;

  public WebsiteChecker(WebsiteProbe probe, ScannerProperties properties) {
    this.probe = probe;
    this.tlds = List.copyOf(properties.getWebsiteCheck().getTlds());
  }

  public WebsiteCheckOutcome check(String businessName) {
    List<String> domains = CandidateDomains.forName(businessName, tlds);
    List<String> errors = new ArrayList<>();
    String urlChecked = domains.isEmpty() ? null : "https://" + domains.get(0);
    Map<String, Object> dnsRecords = null;
    HttpProbeResult lastResponse = null;

    for (String domain : domains) {
      String url = "https://" + domain;
      List<String> addresses;
      try {
        addresses = probe.resolve(domain);
      } catch (DomainNotFoundException e) {
        log.debug("{} does not resolve", domain);
        continue;
      } catch (ProbeException e) {
        log.debug("DNS lookup of {} failed: {}", domain, e.getMessage());
        errors.add(domain + ": " + e.getMessage());
        continue;
      }
      dnsRecords = dnsRecords(domain, addresses);

      HttpProbeResult response;
      urlChecked = url;
      try {
        response = probe.fetch(url);
      } catch (ProbeException e) {
        log.debug("Fetching {} failed: {}", url, e.getMessage());
        errors.add(url + ": " + e.getMessage());
        continue;
      }
      lastResponse = response;
      if (response.isReachable()) {
        double confidence = response.statusCode() == 200 ? CONFIDENCE_OK : CONFIDENCE_REACHABLE;
        log.debug("{} answered {}", url, response.statusCode());
        return new WebsiteCheckOutcome(
            true,
            confidence,
            url,
            url,
            response.statusCode(),
            response.elapsedSeconds(),
            dnsRecords,
            new LinkedHashMap<>(response.headers()),
            errors.isEmpty() ? null : String.join("; ", errors),
            false);
      }
      log.debug("{} answered {}, trying next candidate", url, response.statusCode());
    }

    return new WebsiteCheckOutcome(
        false,
        0.0,
        null,
        urlChecked,
        lastResponse == null ? null : lastResponse.statusCode(),
        lastResponse == null ? null : lastResponse.elapsedSeconds(),
        dnsRecords,
        lastResponse == null ? null : new LinkedHashMap<>(lastResponse.headers()),
        errors.isEmpty() ? null : String.join("; ", errors),
        !errors.isEmpty());
  }

  private static Map<String, Object> dnsRecords(String domain, List<String> addresses) {
    Map<String, Object> records = new LinkedHashMap<>();
    records.put("domain", domain);
    records.put("addresses", List.copyOf(addresses));
    return records;
  }
}
