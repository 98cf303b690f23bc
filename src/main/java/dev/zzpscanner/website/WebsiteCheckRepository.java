package dev.zzpscanner.website;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link WebsiteCheck} entities. */
public interface WebsiteCheckRepository
    extends JpaRepository<WebsiteCheck, Long>, JpaSpecificationExecutor<WebsiteCheck> {

  List<WebsiteCheck> findByBusinessIdOrderByCreatedAtDesc(Long businessId);

  List<WebsiteCheck> findByOrderByCreatedAtDesc(Pageable pageable);

  long countByCreatedAtAfter(Instant since);

  long countByCreatedAtAfterAndErrorFalse(Instant since);

  long countByCreatedAtAfterAndWebsiteExistsTrue(Instant since);

  @Query("SELECT COUNT(c) FROM WebsiteCheck c WHERE c.createdAt >= :from AND c.createdAt < :to")
  long countCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);

  /**
   * Deletes checks created before the cutoff.
   *
   * @return number of deleted checks
   */
  @Modifying
  @Transactional
  @Query("DELETE FROM WebsiteCheck c WHERE c.createdAt < :cutoff")
  int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
