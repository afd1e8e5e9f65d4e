package com.eyelevel.documentcompressor.dto.stats;

import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Compression figures for one document type. Size statistics cover every document of the type, the byte totals
 * and savings only the completed ones.
 */
@Builder
public record TypeAnalysis(String typeId,
                           String name,
                           CompressionMethod compressionMethod,
                           int compressionLevel,
                           long minSizeForCompression,
                           long totalDocuments,
                           long compressedDocuments,
                           long failedDocuments,
                           long skippedDocuments,
                           long pendingDocuments,
                           long processingDocuments,
                           long originalBytes,
                           long compressedBytes,
                           Long averageOriginalSize,
                           Long minOriginalSize,
                           Long maxOriginalSize,
                           BigDecimal savingsPercent) {
}
