package dev.zzpscanner.website;

import java.util.List;

/** Network access used by website checks. */
public interface WebsiteProbe {

  /**
   * Resolves a domain to its addresses.
   *
   * @return host addresses, never empty
   * @throws DomainNotFoundException if the name does not exist
   * @throws ProbeException if the lookup failed for another reason
   */
  List<String> resolve(String domain);

  /**
   * Fetches a URL with the configured timeout and client identifier.
   *
   * @throws ProbeException if no HTTP response was received
   */
  HttpProbeResult fetch(String url);
}
