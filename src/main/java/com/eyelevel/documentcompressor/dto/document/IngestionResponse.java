package com.eyelevel.documentcompressor.dto.document;

import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.JobPriority;

import java.util.UUID;

/**
 * The result of registering a document and queueing its compression job.
 */
public record IngestionResponse(UUID documentId, Long jobId, CompressionStatus compressionStatus,
                                JobPriority priority) {
}
