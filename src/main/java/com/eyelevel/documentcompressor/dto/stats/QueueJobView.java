package com.eyelevel.documentcompressor.dto.stats;

import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.JobStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record QueueJobView(Long jobId,
                           UUID documentId,
                           JobPriority priority,
                           JobStatus status,
                           int attempts,
                           LocalDateTime queuedAt,
                           LocalDateTime availableAt,
                           LocalDateTime startedAt,
                           LocalDateTime completedAt,
                           String errorMessage) {
}
