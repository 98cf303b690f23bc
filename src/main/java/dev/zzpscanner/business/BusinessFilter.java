package dev.zzpscanner.business;

import jakarta.persistence.criteria.Predicate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.domain.Specification;

/**
 * Optional list filters for businesses. Null fields do not constrain the result.
 *
 * @param city case-insensitive prefix of the city
 * @param country case-insensitive prefix of the country
 * @param websiteExists cached website flag to match
 * @param selfEmployed self-employed flag to match
 * @param source exact discovery source name
 */
public record BusinessFilter(
    @Nullable String city,
    @Nullable String country,
    @Nullable Boolean websiteExists,
    @Nullable Boolean selfEmployed,
    @Nullable String source) {

  public static BusinessFilter none() {
    return new BusinessFilter(null, null, null, null, null);
  }

  Specification<Business> toSpecification() {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();
      if (city != null && !city.isBlank()) {
        predicates.add(cb.like(cb.lower(root.get("city")), prefixPattern(city)));
      }
      if (country != null && !country.isBlank()) {
        predicates.add(cb.like(cb.lower(root.get("country")), prefixPattern(country)));
      }
      if (websiteExists != null) {
        predicates.add(cb.equal(root.get("websiteExists"), websiteExists));
      }
      if (selfEmployed != null) {
        predicates.add(cb.equal(root.get("selfEmployed"), selfEmployed));
      }
      if (source != null && !source.isBlank()) {
        predicates.add(cb.equal(root.get("source"), source));
      }
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }

  private static String prefixPattern(String value) {
    String escaped = value.trim().toLowerCase(Locale.ROOT).replace("%", "").replace("_", "");
    return escaped + "%";
  }
}
