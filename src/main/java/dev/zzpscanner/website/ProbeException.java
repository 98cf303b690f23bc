package dev.zzpscanner.website;

/** A DNS lookup or HTTP fetch against a candidate domain failed. */
public class ProbeException extends RuntimeException {

  public ProbeException(String message) {
    super(message);
  }

  public ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
