package com.eyelevel.documentcompressor.dto.stats;

import com.eyelevel.documentcompressor.model.CompressionStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * System-wide compression figures. Byte totals and savings only count completed documents.
 */
@Builder
public record CompressionOverview(Map<CompressionStatus, Long> statusCounts,
                                  long totalDocuments,
                                  long originalBytes,
                                  long compressedBytes,
                                  long spaceSavedBytes,
                                  BigDecimal savingsPercent,
                                  LocalDateTime lastCompressionAt) {
}
