package dev.zzpscanner.job;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link Job} entities. */
public interface JobRepository extends JpaRepository<Job, Long>, JpaSpecificationExecutor<Job> {

  /**
   * Loads a job holding a row lock until the surrounding transaction ends, so that a cancellation
   * and a concurrent executor report are applied one after the other.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT j FROM Job j WHERE j.id = :id")
  Optional<Job> findByIdForUpdate(@Param("id") long id);

  long countByStatus(JobStatus status);

  /** Jobs that reached the given status with a completion time in {@code [from, to)}. */
  @Query(
      "SELECT COUNT(j) FROM Job j WHERE j.status = :status"
          + " AND j.completedAt >= :from AND j.completedAt < :to")
  long countFinishedBetween(
      @Param("status") JobStatus status, @Param("from") Instant from, @Param("to") Instant to);

  List<Job> findByStatus(JobStatus status);

  List<Job> findByOrderByCreatedAtDesc(Pageable pageable);

  @Query(
      "SELECT j.kind AS kind, j.status AS status, COUNT(j) AS total FROM Job j"
          + " GROUP BY j.kind, j.status")
  List<KindStatusCount> countByKindAndStatus();

  /**
   * Deletes jobs in one of the given (terminal) states that completed before the cutoff.
   *
   * @return number of deleted jobs
   */
  @Modifying
  @Transactional
  @Query("DELETE FROM Job j WHERE j.status IN :statuses AND j.completedAt < :cutoff")
  int deleteFinishedBefore(
      @Param("statuses") Collection<JobStatus> statuses, @Param("cutoff") Instant cutoff);
}
