package com.eyelevel.documentcompressor.model;

import java.util.Set;

/**
 * Lifecycle states of a {@link CompressionJob}.
 * <p>
 * Valid transitions: {@code QUEUED -> RUNNING}, {@code RUNNING -> COMPLETED}, {@code RUNNING -> QUEUED}
 * (retry) and {@code RUNNING -> FAILED} (attempts exhausted).
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public static final Set<JobStatus> ACTIVE = Set.of(QUEUED, RUNNING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
