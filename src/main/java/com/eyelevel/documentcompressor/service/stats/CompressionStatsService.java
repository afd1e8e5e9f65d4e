package com.eyelevel.documentcompressor.service.stats;

import com.eyelevel.documentcompressor.dto.document.DocumentAuditView;
import com.eyelevel.documentcompressor.dto.document.DocumentStatusView;
import com.eyelevel.documentcompressor.dto.stats.CompressionOverview;
import com.eyelevel.documentcompressor.dto.stats.QueueJobView;
import com.eyelevel.documentcompressor.dto.stats.TypeAnalysis;
import com.eyelevel.documentcompressor.exception.DocumentNotFoundException;
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.DocumentType;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.repository.CompressionJobRepository;
import com.eyelevel.documentcompressor.repository.DocumentStatusAggregate;
import com.eyelevel.documentcompressor.repository.DocumentTypeRepository;
import com.eyelevel.documentcompressor.repository.MediaDocumentRepository;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only reporting over documents and compression jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CompressionStatsService {

    public static final int MAX_SNAPSHOT_LIMIT = 500;

    private final MediaDocumentRepository mediaDocumentRepository;
    private final DocumentTypeRepository documentTypeRepository;
    private final CompressionJobRepository compressionJobRepository;
    private final CompressionQueue compressionQueue;

    public CompressionOverview overview() {
        final List<DocumentStatusAggregate> aggregates = mediaDocumentRepository.aggregateByTypeAndStatus();
        final Map<CompressionStatus, Long> statusCounts = emptyStatusCounts();
        long total = 0;
        long originalBytes = 0;
        long compressedBytes = 0;
        for (final DocumentStatusAggregate row : aggregates) {
            final long count = nullToZero(row.getDocumentCount());
            statusCounts.merge(row.getStatus(), count, Long::sum);
            total += count;
            if (row.getStatus() == CompressionStatus.COMPLETED) {
                originalBytes += nullToZero(row.getOriginalBytes());
                compressedBytes += nullToZero(row.getCompressedBytes());
            }
        }
        log.debug("Computed compression overview over {} documents.", total);
        return CompressionOverview.builder()
                .statusCounts(statusCounts)
                .totalDocuments(total)
                .originalBytes(originalBytes)
                .compressedBytes(compressedBytes)
                .spaceSavedBytes(originalBytes - compressedBytes)
                .savingsPercent(savingsPercent(originalBytes, compressedBytes))
                .lastCompressionAt(mediaDocumentRepository.findLastCompressedAt().orElse(null))
                .build();
    }

    /**
     * One entry per registered document type, including types without documents.
     */
    public List<TypeAnalysis> perTypeAnalysis() {
        final List<DocumentStatusAggregate> aggregates = mediaDocumentRepository.aggregateByTypeAndStatus();
        return documentTypeRepository.findAllByOrderByIdAsc().stream()
                .map(type -> analyse(type, aggregates))
                .toList();
    }

    /**
     * The most recently queued jobs, newest first.
     *
     * @param limit Between 1 and {@value #MAX_SNAPSHOT_LIMIT}.
     */
    public List<QueueJobView> queueSnapshot(final int limit) {
        if (limit < 1 || limit > MAX_SNAPSHOT_LIMIT) {
            throw new DocumentValidationException(
                    "Queue snapshot limit must be between 1 and " + MAX_SNAPSHOT_LIMIT + ", got " + limit + ".");
        }
        return compressionJobRepository.findAllByOrderByQueuedAtDescIdDesc(PageRequest.of(0, limit)).stream()
                .map(CompressionStatsService::toQueueJobView)
                .toList();
    }

    public List<DocumentAuditView> failedDocuments() {
        return auditListing(CompressionStatus.FAILED);
    }

    public List<DocumentAuditView> completedDocuments() {
        return auditListing(CompressionStatus.COMPLETED);
    }

    public Map<JobStatus, Long> queueStatus() {
        return compressionQueue.queueStatus();
    }

    public DocumentStatusView documentStatus(final UUID documentId) {
        final MediaDocument document = mediaDocumentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found with ID: " + documentId));
        final List<CompressionJob> jobs = compressionJobRepository.findByDocumentIdOrderByIdAsc(documentId);
        final Optional<CompressionJob> latest = jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(jobs.size() - 1));
        return DocumentStatusView.builder()
                .documentId(document.getId())
                .originalFilename(document.getOriginalFilename())
                .compressionStatus(document.getCompressionStatus())
                .hasError(document.isHasError())
                .errorMessage(document.getErrorMessage())
                .skipReason(document.getSkipReason())
                .sizeBytes(document.getSizeBytes())
                .compressedSizeBytes(document.getCompressedSizeBytes())
                .compressedPath(document.getCompressedPath())
                .compressedAt(document.getCompressedAt())
                .latestJobId(latest.map(CompressionJob::getId).orElse(null))
                .latestJobStatus(latest.map(CompressionJob::getStatus).orElse(null))
                .attempts(latest.map(CompressionJob::getAttempts).orElse(null))
                .build();
    }

    /**
     * {@code (original - compressed) / original * 100}, two decimals, half-up. Zero when nothing was compressed.
     */
    public static BigDecimal savingsPercent(final long originalBytes, final long compressedBytes) {
        if (originalBytes <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(originalBytes - compressedBytes)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(originalBytes), 2, RoundingMode.HALF_UP);
    }

    private TypeAnalysis analyse(final DocumentType type, final List<DocumentStatusAggregate> aggregates) {
        final Map<CompressionStatus, Long> counts = emptyStatusCounts();
        long total = 0;
        long completedOriginal = 0;
        long compressed = 0;
        long sizeSum = 0;
        Long min = null;
        Long max = null;
        for (final DocumentStatusAggregate row : aggregates) {
            if (!type.getId().equals(row.getTypeId())) {
                continue;
            }
            final long count = nullToZero(row.getDocumentCount());
            counts.merge(row.getStatus(), count, Long::sum);
            total += count;
            sizeSum += nullToZero(row.getOriginalBytes());
            if (row.getMinOriginalBytes() != null) {
                min = min == null ? row.getMinOriginalBytes() : Math.min(min, row.getMinOriginalBytes());
            }
            if (row.getMaxOriginalBytes() != null) {
                max = max == null ? row.getMaxOriginalBytes() : Math.max(max, row.getMaxOriginalBytes());
            }
            if (row.getStatus() == CompressionStatus.COMPLETED) {
                completedOriginal += nullToZero(row.getOriginalBytes());
                compressed += nullToZero(row.getCompressedBytes());
            }
        }
        return TypeAnalysis.builder()
                .typeId(type.getId())
                .name(type.getName())
                .compressionMethod(type.getCompressionMethod())
                .compressionLevel(type.getCompressionLevel())
                .minSizeForCompression(type.getMinSizeForCompression())
                .totalDocuments(total)
                .compressedDocuments(counts.get(CompressionStatus.COMPLETED))
                .failedDocuments(counts.get(CompressionStatus.FAILED))
                .skippedDocuments(counts.get(CompressionStatus.SKIPPED))
                .pendingDocuments(counts.get(CompressionStatus.PENDING))
                .processingDocuments(counts.get(CompressionStatus.PROCESSING))
                .originalBytes(completedOriginal)
                .compressedBytes(compressed)
                .averageOriginalSize(total == 0 ? null : sizeSum / total)
                .minOriginalSize(min)
                .maxOriginalSize(max)
                .savingsPercent(savingsPercent(completedOriginal, compressed))
                .build();
    }

    private List<DocumentAuditView> auditListing(final CompressionStatus status) {
        return mediaDocumentRepository.findByCompressionStatusOrderByUpdatedAtDesc(status).stream()
                .map(d -> new DocumentAuditView(d.getId(), d.getOriginalFilename(), d.getTypeId(),
                        d.getCompressionStatus(), d.getSizeBytes(), d.getCompressedSizeBytes(), d.getOriginalPath(),
                        d.getCompressedPath(), d.getErrorMessage(), d.getUpdatedAt()))
                .toList();
    }

    private static QueueJobView toQueueJobView(final CompressionJob job) {
        return new QueueJobView(job.getId(), job.getDocumentId(), job.getPriority(), job.getStatus(),
                job.getAttempts(), job.getQueuedAt(), job.getAvailableAt(), job.getStartedAt(), job.getCompletedAt(),
                job.getErrorMessage());
    }

    private static Map<CompressionStatus, Long> emptyStatusCounts() {
        final Map<CompressionStatus, Long> counts = new EnumMap<>(CompressionStatus.class);
        for (final CompressionStatus status : CompressionStatus.values()) {
            counts.put(status, 0L);
        }
        return counts;
    }

    private static long nullToZero(final Long value) {
        return value == null ? 0L : value;
    }
}
