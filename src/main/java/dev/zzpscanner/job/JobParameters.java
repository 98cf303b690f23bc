package dev.zzpscanner.job;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Schema-less input of a job, persisted as a JSON object.
 *
 * <p>The shape depends on the job kind: discovery jobs carry {@value #TARGET_LOCATION} and
 * optionally {@value #TARGET_INDUSTRY}; website-check and enrichment jobs optionally carry {@value
 * #BUSINESS_IDS}. Readers pull typed values by key and fail with {@link IllegalArgumentException}
 * when a value has the wrong shape.
 */
public final class JobParameters {

  public static final String TARGET_LOCATION = "target_location";
  public static final String TARGET_INDUSTRY = "target_industry";
  public static final String BUSINESS_IDS = "business_ids";

  private static final JobParameters EMPTY = new JobParameters(Map.of());

  private final Map<String, Object> values;

  private JobParameters(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static JobParameters of(@Nullable Map<String, Object> values) {
    return values == null || values.isEmpty() ? EMPTY : new JobParameters(values);
  }

  public static JobParameters empty() {
    return EMPTY;
  }

  public static JobParameters discovery(String location, @Nullable String industry) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(TARGET_LOCATION, location);
    if (industry != null && !industry.isBlank()) {
      values.put(TARGET_INDUSTRY, industry);
    }
    return new JobParameters(values);
  }

  /**
   * Parameters targeting the given businesses, or no explicit target when ids is null.
   *
   * @throws IllegalArgumentException if the list contains a null id
   */
  public static JobParameters businessIds(@Nullable Collection<Long> ids) {
    if (ids == null) {
      return EMPTY;
    }
    if (ids.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException(BUSINESS_IDS + " must not contain null");
    }
    return new JobParameters(Map.of(BUSINESS_IDS, List.copyOf(ids)));
  }

  public @Nullable String getString(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof String s) {
      return s;
    }
    throw new IllegalArgumentException(
        "Parameter '%s' must be a string, got: %s".formatted(key, value));
  }

  /**
   * Reads a list of ids. JSON numbers come back as Integer or Long depending on size, so any
   * integral {@link Number} is accepted.
   *
   * @return the ids, or null when the key is absent
   */
  public @Nullable List<Long> getLongList(String key) {
    Object value = values.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Collection<?> collection)) {
      throw new IllegalArgumentException(
          "Parameter '%s' must be a list, got: %s".formatted(key, value));
    }
    List<Long> ids = new ArrayList<>(collection.size());
    for (Object element : collection) {
      if (element instanceof Number number && number.doubleValue() == number.longValue()) {
        ids.add(number.longValue());
      } else {
        throw new IllegalArgumentException(
            "Parameter '%s' must contain integers, got: %s".formatted(key, element));
      }
    }
    return ids;
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Returns a copy without the given key. */
  public JobParameters without(String key) {
    if (!values.containsKey(key)) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.remove(key);
    return of(copy);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof JobParameters other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
