package dev.zzpscanner.business;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Catalog operations on businesses: filtered listing, lookup, create, partial update, delete,
 * free-text search and summary statistics.
 *
 * <p>Deleting a business also removes its website checks through the database cascade.
 */
@Service
public class BusinessService {

  private static final Logger log = LoggerFactory.getLogger(BusinessService.class);

  private final BusinessRepository businessRepository;

  public BusinessService(BusinessRepository businessRepository) {
    this.businessRepository = businessRepository;
  }

  @Transactional(readOnly = true)
  public List<Business> list(BusinessFilter filter, Pageable pageable) {
    return businessRepository.findAll(filter.toSpecification(), pageable).getContent();
  }

  @Transactional(readOnly = true)
  public Business get(long id) {
    return businessRepository.findById(id).orElseThrow(() -> new BusinessNotFoundException(id));
  }

  @Transactional
  public Business create(BusinessFields fields) {
    if (fields.name() == null || fields.name().isBlank()) {
      throw new IllegalArgumentException("name is required");
    }
    Business business = new Business(fields.name().trim());
    fields.applyTo(business);
    Business saved = businessRepository.save(business);
    log.info("Created business {} '{}'", saved.getId(), saved.getName());
    return saved;
  }

  @Transactional
  public Business update(long id, BusinessFields fields) {
    Business business = get(id);
    fields.applyTo(business);
    return businessRepository.save(business);
  }

  @Transactional
  public void delete(long id) {
    Business business = get(id);
    businessRepository.delete(business);
    log.info("Deleted business {} '{}'", id, business.getName());
  }

  @Transactional(readOnly = true)
  public List<Business> search(String query, Pageable pageable) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Search query must not be blank");
    }
    return businessRepository.search(query.trim(), pageable);
  }

  @Transactional(readOnly = true)
  public BusinessSummary summary() {
    long total = businessRepository.count();
    long withWebsite = businessRepository.countByWebsiteExistsTrue();
    long withoutWebsite = businessRepository.countByWebsiteExistsFalse();
    double percentage = total == 0 ? 0.0 : Math.round(withWebsite * 10000.0 / total) / 100.0;
    return new BusinessSummary(
        total,
        businessRepository.countBySelfEmployedTrue(),
        withWebsite,
        withoutWebsite,
        percentage,
        toMap(businessRepository.countByCountry()),
        toMap(businessRepository.countBySource()));
  }

  static Map<String, Long> toMap(List<LabelCount> counts) {
    Map<String, Long> result = new LinkedHashMap<>();
    for (LabelCount count : counts) {
      result.put(count.getLabel(), count.getTotal());
    }
    return result;
  }
}
