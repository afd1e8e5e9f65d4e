package com.eyelevel.documentcompressor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Per document-type compression configuration. Rows are read-mostly and cached by the policy registry.
 */
@Entity
@Table(name = "document_type")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentType {

    /**
     * User-defined key, e.g. {@code "scanned-report"}.
     */
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CompressionMethod compressionMethod;

    @Column(nullable = false)
    private int compressionLevel;

    /**
     * Documents smaller than this many bytes are never compressed.
     */
    @Column(nullable = false)
    private long minSizeForCompression;

    @Convert(converter = JobPriorityConverter.class)
    @Column(nullable = false)
    private JobPriority defaultPriority;

    @Column(length = 1024)
    private String description;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
