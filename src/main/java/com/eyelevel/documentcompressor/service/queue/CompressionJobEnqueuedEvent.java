package com.eyelevel.documentcompressor.service.queue;

import java.util.UUID;

/**
 * Published when a compression job is queued. Listeners run after the enqueuing transaction commits.
 */
public record CompressionJobEnqueuedEvent(Long jobId, UUID documentId) {
}
