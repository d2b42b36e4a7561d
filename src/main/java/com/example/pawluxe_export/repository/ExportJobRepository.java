package com.example.pawluxe_export.repository;

import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.util.ExportJobStatus;
import jakarta.transaction.Transactional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every status change is a conditional update that names the prior state it expects; a return value of
 * {@code 0} means that state no longer holds and nothing was written.
 */
public interface ExportJobRepository extends JpaRepository<ExportJob, UUID> {
    long countByStatus(ExportJobStatus status);

    Optional<ExportJob> findByActiveDedupeKey(String activeDedupeKey);

    /**
     * Locks the oldest eligible pending row for the calling transaction. Rows another claimer holds are
     * skipped instead of waited for; must run inside the transaction that then claims the row.
     */
    @Query(value = """
        SELECT id FROM export_job
        WHERE status = 'PENDING'
          AND (next_run_at IS NULL OR next_run_at <= :now)
        ORDER BY created_at, id
        FETCH FIRST 1 ROWS ONLY
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<UUID> lockNextEligibleId(@Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING,
               j.owningWorker = :worker,
               j.startedAt = coalesce(j.startedAt, :now),
               j.claimedAt = :now,
               j.heartbeatAt = :now,
               j.errorMessage = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.pawluxe_export.util.ExportJobStatus.PENDING
           and (j.nextRunAt is null or j.nextRunAt <= :now)
        """)
    int claim(@Param("id") UUID id, @Param("worker") String worker, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.heartbeatAt = :now,
               j.updatedAt = :now
         where j.id = :id
           and j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING
           and j.owningWorker = :worker
        """)
    int heartbeat(@Param("id") UUID id, @Param("worker") String worker, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.DONE,
               j.finishedAt = :now,
               j.outputPath = :outputPath,
               j.manifestPath = :manifestPath,
               j.errorMessage = null,
               j.nextRunAt = null,
               j.owningWorker = null,
               j.activeDedupeKey = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING
           and j.owningWorker = :worker
        """)
    int markDone(@Param("id") UUID id,
                 @Param("worker") String worker,
                 @Param("outputPath") String outputPath,
                 @Param("manifestPath") String manifestPath,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.PENDING,
               j.retryCount = j.retryCount + 1,
               j.nextRunAt = :nextRunAt,
               j.errorMessage = :error,
               j.owningWorker = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING
           and j.owningWorker = :worker
           and j.retryCount = :expectedRetryCount
           and j.retryCount < j.maxRetries
        """)
    int requeue(@Param("id") UUID id,
                @Param("worker") String worker,
                @Param("expectedRetryCount") int expectedRetryCount,
                @Param("nextRunAt") Instant nextRunAt,
                @Param("error") String error,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.FAILED,
               j.finishedAt = :now,
               j.errorMessage = :error,
               j.nextRunAt = null,
               j.owningWorker = null,
               j.activeDedupeKey = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING
           and j.owningWorker = :worker
        """)
    int markFailed(@Param("id") UUID id,
                   @Param("worker") String worker,
                   @Param("error") String error,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.CANCELED,
               j.canceledAt = :now,
               j.nextRunAt = null,
               j.owningWorker = null,
               j.activeDedupeKey = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in (com.example.pawluxe_export.util.ExportJobStatus.PENDING,
                            com.example.pawluxe_export.util.ExportJobStatus.RUNNING)
        """)
    int cancel(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update ExportJob j
           set j.status = com.example.pawluxe_export.util.ExportJobStatus.PENDING,
               j.activeDedupeKey = j.dedupeKey,
               j.retryCount = 0,
               j.nextRunAt = null,
               j.errorMessage = null,
               j.outputPath = null,
               j.manifestPath = null,
               j.startedAt = null,
               j.claimedAt = null,
               j.heartbeatAt = null,
               j.finishedAt = null,
               j.canceledAt = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in (com.example.pawluxe_export.util.ExportJobStatus.FAILED,
                            com.example.pawluxe_export.util.ExportJobStatus.CANCELED)
        """)
    int retry(@Param("id") UUID id, @Param("now") Instant now);

    @Query("""
        select j from ExportJob j
        where j.status = com.example.pawluxe_export.util.ExportJobStatus.RUNNING
          and coalesce(j.heartbeatAt, j.claimedAt, j.startedAt) < :cutoff
        order by j.createdAt asc
        """)
    List<ExportJob> findStaleRunning(@Param("cutoff") Instant cutoff);
}
