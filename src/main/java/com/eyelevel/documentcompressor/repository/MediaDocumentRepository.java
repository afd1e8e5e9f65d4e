package com.eyelevel.documentcompressor.repository;

import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.MediaDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link MediaDocument} entity.
 * <p>
 * Every status change is a single conditional UPDATE that writes the status together with the derived-artifact
 * columns, so no reader can observe a compressed path without the {@code COMPLETED} status or the reverse.
 * Each method returns the number of rows changed; {@code 0} means the document was not in an expected state.
 */
@Repository
public interface MediaDocumentRepository extends JpaRepository<MediaDocument, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE MediaDocument d
               SET d.compressionStatus = com.eyelevel.documentcompressor.model.CompressionStatus.PROCESSING,
                   d.hasError = false, d.errorMessage = null, d.skipReason = null,
                   d.compressedPath = null, d.compressedSizeBytes = null, d.compressedAt = null,
                   d.updatedAt = :now
             WHERE d.id = :id AND d.compressionStatus IN :expected
            """)
    int markProcessing(@Param("id") UUID id, @Param("expected") Collection<CompressionStatus> expected,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE MediaDocument d
               SET d.compressionStatus = com.eyelevel.documentcompressor.model.CompressionStatus.COMPLETED,
                   d.compressedPath = :path, d.compressedSizeBytes = :size, d.compressedAt = :now,
                   d.hasError = false, d.errorMessage = null, d.skipReason = null,
                   d.updatedAt = :now
             WHERE d.id = :id AND d.compressionStatus = com.eyelevel.documentcompressor.model.CompressionStatus.PROCESSING
            """)
    int markCompleted(@Param("id") UUID id, @Param("path") String compressedPath, @Param("size") long compressedSize,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE MediaDocument d
               SET d.compressionStatus = com.eyelevel.documentcompressor.model.CompressionStatus.FAILED,
                   d.hasError = true, d.errorMessage = :error, d.skipReason = null,
                   d.compressedPath = null, d.compressedSizeBytes = null, d.compressedAt = null,
                   d.updatedAt = :now
             WHERE d.id = :id AND d.compressionStatus IN :expected
            """)
    int markFailed(@Param("id") UUID id, @Param("error") String errorMessage,
                   @Param("expected") Collection<CompressionStatus> expected, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE MediaDocument d
               SET d.compressionStatus = com.eyelevel.documentcompressor.model.CompressionStatus.SKIPPED,
                   d.skipReason = :reason, d.hasError = false, d.errorMessage = null,
                   d.compressedPath = null, d.compressedSizeBytes = null, d.compressedAt = null,
                   d.updatedAt = :now
             WHERE d.id = :id AND d.compressionStatus IN :expected
            """)
    int markSkipped(@Param("id") UUID id, @Param("reason") String reason,
                    @Param("expected") Collection<CompressionStatus> expected, @Param("now") LocalDateTime now);

    @Query("SELECT d.compressionStatus FROM MediaDocument d WHERE d.id = :id")
    Optional<CompressionStatus> findCompressionStatusById(@Param("id") UUID id);

    List<MediaDocument> findByCompressionStatusOrderByUpdatedAtDesc(CompressionStatus status);

    @Query("""
            SELECT d.typeId AS typeId, d.compressionStatus AS status, COUNT(d) AS documentCount,
                   SUM(d.sizeBytes) AS originalBytes, SUM(d.compressedSizeBytes) AS compressedBytes,
                   MIN(d.sizeBytes) AS minOriginalBytes, MAX(d.sizeBytes) AS maxOriginalBytes
              FROM MediaDocument d
             GROUP BY d.typeId, d.compressionStatus
            """)
    List<DocumentStatusAggregate> aggregateByTypeAndStatus();

    @Query("SELECT MAX(d.compressedAt) FROM MediaDocument d")
    Optional<LocalDateTime> findLastCompressedAt();
}
