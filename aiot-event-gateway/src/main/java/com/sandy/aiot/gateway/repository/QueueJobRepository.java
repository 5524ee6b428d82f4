package com.sandy.aiot.gateway.repository;

import com.sandy.aiot.gateway.entity.JobStatus;
import com.sandy.aiot.gateway.entity.QueueJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueueJobRepository extends JpaRepository<QueueJob, Long> {

    List<QueueJob> findTop10ByStatusAndNextRunAtLessThanEqualOrderByNextRunAtAscIdAsc(JobStatus status, Instant now);

    List<QueueJob> findByStatusOrderByUpdatedAtDesc(JobStatus status, Pageable pageable);

    long countByStatus(JobStatus status);

    /**
     * Conditional PENDING -> ACTIVE transition. Returns 1 for the single worker that wins the job.
     */
    @Modifying
    @Transactional
    @Query("update QueueJob j set j.status = :active, j.lockedBy = :worker, j.lockedAt = :now, " +
            "j.attempts = j.attempts + 1, j.updatedAt = :now " +
            "where j.id = :id and j.status = :pending")
    int claim(@Param("id") Long id,
              @Param("worker") String worker,
              @Param("now") Instant now,
              @Param("pending") JobStatus pending,
              @Param("active") JobStatus active);

    /**
     * Records the outcome of an attempt, but only while the caller still holds the claim.
     * Returns 0 when the lease was released and the job re-claimed in the meantime.
     */
    @Modifying
    @Transactional
    @Query("update QueueJob j set j.status = :status, j.lastError = :error, j.nextRunAt = :nextRunAt, " +
            "j.completedAt = :completedAt, j.updatedAt = :now, j.lockedBy = null, j.lockedAt = null " +
            "where j.id = :id and j.lockedBy = :worker and j.status = :active")
    int finishIfOwned(@Param("id") Long id,
                      @Param("worker") String worker,
                      @Param("status") JobStatus status,
                      @Param("error") String error,
                      @Param("nextRunAt") Instant nextRunAt,
                      @Param("completedAt") Instant completedAt,
                      @Param("now") Instant now,
                      @Param("active") JobStatus active);

    /** ACTIVE jobs locked before the cutoff go back to PENDING (worker crashed or lease expired). */
    @Modifying
    @Transactional
    @Query("update QueueJob j set j.status = :pending, j.lockedBy = null, j.lockedAt = null, j.updatedAt = :now " +
            "where j.status = :active and j.lockedAt < :cutoff")
    int releaseActiveLockedBefore(@Param("cutoff") Instant cutoff,
                                  @Param("now") Instant now,
                                  @Param("pending") JobStatus pending,
                                  @Param("active") JobStatus active);

    @Modifying
    @Transactional
    @Query("delete from QueueJob j where j.status = :status and j.updatedAt < :cutoff")
    int deleteByStatusUpdatedBefore(@Param("status") JobStatus status, @Param("cutoff") Instant cutoff);
}
