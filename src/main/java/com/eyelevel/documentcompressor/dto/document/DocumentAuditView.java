package com.eyelevel.documentcompressor.dto.document;

import com.eyelevel.documentcompressor.model.CompressionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A row of the completed/failed document audit listings.
 */
public record DocumentAuditView(UUID documentId,
                                String originalFilename,
                                String typeId,
                                CompressionStatus compressionStatus,
                                long sizeBytes,
                                Long compressedSizeBytes,
                                String originalPath,
                                String compressedPath,
                                String errorMessage,
                                LocalDateTime updatedAt) {
}
