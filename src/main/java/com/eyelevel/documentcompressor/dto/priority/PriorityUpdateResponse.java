package com.eyelevel.documentcompressor.dto.priority;

import com.eyelevel.documentcompressor.model.JobPriority;

/**
 * @param priority     The priority that was applied.
 * @param updatedJobs  The number of queued jobs that changed. Running and finished jobs are never touched.
 */
public record PriorityUpdateResponse(JobPriority priority, int updatedJobs) {
}
