package dev.zzpscanner.business;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Business} entities. */
public interface BusinessRepository
    extends JpaRepository<Business, Long>, JpaSpecificationExecutor<Business> {

  boolean existsBySourceAndSourceId(String source, String sourceId);

  List<Business> findByIdInOrderByIdAsc(Collection<Long> ids);

  /** Businesses no website check has touched yet, oldest first. */
  List<Business> findByLastCheckedIsNullOrderByIdAsc(Pageable pageable);

  List<Business> findByProcessedFalseOrderByIdAsc(Pageable pageable);

  long countBySelfEmployedTrue();

  long countByWebsiteExistsTrue();

  long countByWebsiteExistsFalse();

  long countByProcessedTrue();

  @Query(
      """
      SELECT b FROM Business b
      WHERE LOWER(b.name) LIKE LOWER(CONCAT('%', :q, '%'))
         OR LOWER(b.city) LIKE LOWER(CONCAT('%', :q, '%'))
         OR LOWER(b.industry) LIKE LOWER(CONCAT('%', :q, '%'))
         OR LOWER(b.businessType) LIKE LOWER(CONCAT('%', :q, '%'))
      ORDER BY b.id
      """)
  List<Business> search(@Param("q") String query, Pageable pageable);

  @Query(
      "SELECT b.country AS label, COUNT(b) AS total FROM Business b"
          + " WHERE b.country IS NOT NULL GROUP BY b.country ORDER BY COUNT(b) DESC")
  List<LabelCount> countByCountry();

  @Query(
      "SELECT b.source AS label, COUNT(b) AS total FROM Business b"
          + " WHERE b.source IS NOT NULL GROUP BY b.source ORDER BY COUNT(b) DESC")
  List<LabelCount> countBySource();

  @Query(
      "SELECT b.city AS label, COUNT(b) AS total FROM Business b"
          + " WHERE b.city IS NOT NULL GROUP BY b.city ORDER BY COUNT(b) DESC")
  List<LabelCount> topCities(Pageable pageable);

  @Query(
      "SELECT b.industry AS label, COUNT(b) AS total FROM Business b"
          + " WHERE b.industry IS NOT NULL GROUP BY b.industry ORDER BY COUNT(b) DESC")
  List<LabelCount> topIndustries(Pageable pageable);

  long countByCreatedAtAfter(Instant since);

  @Query("SELECT COUNT(b) FROM Business b WHERE b.createdAt >= :from AND b.createdAt < :to")
  long countCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

  long countBySelfEmployedTrueAndWebsiteExistsFalse();

  /**
   * Deletes businesses created before the cutoff that are not self-employed and were checked to
   * have no website. Businesses never checked are kept. Their website checks go with them
   * through the foreign key cascade.
   *
   * @return number of deleted businesses
   */
  @Modifying
  @Transactional
  @Query(
      "DELETE FROM Business b WHERE b.createdAt < :cutoff AND b.selfEmployed = false"
          + " AND b.websiteExists = false")
  int deleteNonSelfEmployedWithoutWebsiteBefore(@Param("cutoff") Instant cutoff);
}
