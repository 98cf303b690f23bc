package dev.zzpscanner.website;

import java.util.NoSuchElementException;

/** Thrown when a website check id does not exist. */
public class WebsiteCheckNotFoundException extends NoSuchElementException {

  public WebsiteCheckNotFoundException(long id) {
    super("Website check not found: " + id);
  }
}
