package com.eyelevel.documentcompressor.repository;

import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link CompressionJob} entity.
 * <p>
 * State transitions are conditional UPDATEs guarded by the expected current status; a return value of {@code 0}
 * means another actor already moved the job and the caller lost the race.
 */
@Repository
public interface CompressionJobRepository extends JpaRepository<CompressionJob, Long> {

    boolean existsByDocumentIdAndStatusIn(UUID documentId, Collection<JobStatus> statuses);

    List<CompressionJob> findByDocumentIdOrderByIdAsc(UUID documentId);

    List<CompressionJob> findByStatus(JobStatus status);

    List<CompressionJob> findAllByOrderByQueuedAtDescIdDesc(Pageable pageable);

    /**
     * Candidate jobs for a claim, best first: highest priority weight, then oldest {@code queuedAt}, then id.
     */
    @Query("""
            SELECT j.id FROM CompressionJob j
             WHERE j.status = com.eyelevel.documentcompressor.model.JobStatus.QUEUED AND j.availableAt <= :now
             ORDER BY j.priority DESC, j.queuedAt ASC, j.id ASC
            """)
    List<Long> findClaimCandidates(@Param("now") LocalDateTime now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CompressionJob j
               SET j.status = com.eyelevel.documentcompressor.model.JobStatus.RUNNING, j.startedAt = :now
             WHERE j.id = :id AND j.status = com.eyelevel.documentcompressor.model.JobStatus.QUEUED
            """)
    int claim(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CompressionJob j
               SET j.status = com.eyelevel.documentcompressor.model.JobStatus.COMPLETED, j.completedAt = :now,
                   j.activeDocumentId = null
             WHERE j.id = :id AND j.status = com.eyelevel.documentcompressor.model.JobStatus.RUNNING
            """)
    int complete(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CompressionJob j
               SET j.status = com.eyelevel.documentcompressor.model.JobStatus.QUEUED, j.attempts = j.attempts + 1,
                   j.errorMessage = :error, j.availableAt = :availableAt
             WHERE j.id = :id AND j.status = com.eyelevel.documentcompressor.model.JobStatus.RUNNING
               AND j.attempts = :attempts
            """)
    int requeueForRetry(@Param("id") Long id, @Param("attempts") int expectedAttempts, @Param("error") String error,
                        @Param("availableAt") LocalDateTime availableAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CompressionJob j
               SET j.status = com.eyelevel.documentcompressor.model.JobStatus.FAILED, j.attempts = j.attempts + 1,
                   j.errorMessage = :error, j.completedAt = :now, j.activeDocumentId = null
             WHERE j.id = :id AND j.status = com.eyelevel.documentcompressor.model.JobStatus.RUNNING
               AND j.attempts = :attempts
            """)
    int failTerminally(@Param("id") Long id, @Param("attempts") int expectedAttempts, @Param("error") String error,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE CompressionJob j SET j.priority = :priority
             WHERE j.documentId IN :documentIds AND j.status = com.eyelevel.documentcompressor.model.JobStatus.QUEUED
            """)
    int updatePriorityForQueuedJobs(@Param("documentIds") Collection<UUID> documentIds,
                                    @Param("priority") JobPriority priority);

    @Query("SELECT j.status AS status, COUNT(j) AS jobCount FROM CompressionJob j GROUP BY j.status")
    List<JobStatusCount> countByStatus();
}
