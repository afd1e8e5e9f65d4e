package com.eyelevel.documentcompressor.repository;

import com.eyelevel.documentcompressor.model.JobStatus;

/**
 * Projection of the number of compression jobs in one status.
 */
public interface JobStatusCount {

    JobStatus getStatus();

    Long getJobCount();
}
