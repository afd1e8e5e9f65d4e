package com.eyelevel.documentcompressor.dto.document;

import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The current compression state of one document together with its most recent job.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentStatusView(UUID documentId,
                                 String originalFilename,
                                 CompressionStatus compressionStatus,
                                 boolean hasError,
                                 String errorMessage,
                                 String skipReason,
                                 long sizeBytes,
                                 Long compressedSizeBytes,
                                 String compressedPath,
                                 LocalDateTime compressedAt,
                                 Long latestJobId,
                                 JobStatus latestJobStatus,
                                 Integer attempts) {
}
