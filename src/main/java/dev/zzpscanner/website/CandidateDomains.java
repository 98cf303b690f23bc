package dev.zzpscanner.website;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives the domains a business might own from its name: lower-cased, spaces and hyphens
 * removed, followed by each configured TLD in order. {@code "Test Business 2"} gives {@code
 * testbusiness2.nl}, {@code testbusiness2.com} and so on.
 */
public final class CandidateDomains {

  private CandidateDomains() {}

  public static List<String> forName(String businessName, List<String> tlds) {
    if (businessName == null) {
      return List.of();
    }
    String label = businessName.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
    if (label.isBlank()) {
      return List.of();
    }
    List<String> domains = new ArrayList<>(tlds.size());
    for (String tld : tlds) {
      String suffix = tld.startsWith(".") ? tld.substring(1) : tld;
      domains.add(label + "." + suffix.toLowerCase(Locale.ROOT));
    }
    return domains;
  }
}
