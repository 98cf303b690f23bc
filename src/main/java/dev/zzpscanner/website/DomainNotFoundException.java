package dev.zzpscanner.website;

/** The domain does not exist. Not an error for website checks: the next candidate is tried. */
public class DomainNotFoundException extends ProbeException {

  public DomainNotFoundException(String domain) {
    super("Domain not found: " + domain);
  }

  public DomainNotFoundException(String domain, Throwable cause) {
    super("Domain not found: " + domain, cause);
  }
}
