package com.eyelevel.documentcompressor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A durable queue entry for compressing one document.
 * <p>
 * {@code activeDocumentId} mirrors {@code documentId} while the job is {@code QUEUED} or {@code RUNNING} and is
 * cleared on the terminal transition. Its unique constraint is what guarantees a single active job per document,
 * even when two callers enqueue concurrently.
 */
@Entity
@Table(name = "compression_job",
        uniqueConstraints = @UniqueConstraint(name = "uk_compression_job_active_document",
                columnNames = "active_document_id"),
        indexes = {
                @Index(name = "idx_compression_job_claim", columnList = "status, priority, queued_at"),
                @Index(name = "idx_compression_job_document", columnList = "document_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "active_document_id")
    private UUID activeDocumentId;

    @Convert(converter = JobPriorityConverter.class)
    @Column(nullable = false)
    private JobPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "queued_at", nullable = false)
    private LocalDateTime queuedAt;

    /**
     * Earliest instant at which the job may be claimed. Equal to {@code queuedAt} on first enqueue and pushed
     * forward by the retry backoff.
     */
    @Column(nullable = false)
    private LocalDateTime availableAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 4000)
    private String errorMessage;

    @Transient
    public boolean isActive() {
        return status != null && status.isActive();
    }
}
