package dev.zzpscanner.business;

import java.util.NoSuchElementException;

/** Thrown when a business id does not exist in the catalog. */
public class BusinessNotFoundException extends NoSuchElementException {

  public BusinessNotFoundException(long id) {
    super("Business not found: " + id);
  }
}
