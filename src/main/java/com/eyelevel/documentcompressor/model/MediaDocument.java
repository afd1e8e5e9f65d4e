package com.eyelevel.documentcompressor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Metadata for a stored media document and its optional compressed artifact.
 * <p>
 * {@code compressedPath}, {@code compressedSizeBytes} and {@code compressedAt} are non-null exactly when
 * {@code compressionStatus} is {@link CompressionStatus#COMPLETED}. All status changes go through the
 * conditional updates in {@link com.eyelevel.documentcompressor.repository.MediaDocumentRepository}.
 */
@Entity
@Table(name = "media_document", indexes = {
        @Index(name = "idx_media_document_status", columnList = "compression_status"),
        @Index(name = "idx_media_document_type", columnList = "type_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String originalFilename;

    @Column(nullable = false)
    private String mimeType;

    @Column(nullable = false)
    private long sizeBytes;

    private Long compressedSizeBytes;

    @Column(nullable = false, length = 1024)
    private String originalPath;

    @Column(length = 1024)
    private String compressedPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "compression_status", nullable = false, length = 16)
    private CompressionStatus compressionStatus;

    @Column(nullable = false)
    private boolean hasError;

    @Column(length = 4000)
    private String errorMessage;

    @Column(length = 1024)
    private String skipReason;

    @Column(name = "type_id", nullable = false, length = 64)
    private String typeId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime compressedAt;
}
