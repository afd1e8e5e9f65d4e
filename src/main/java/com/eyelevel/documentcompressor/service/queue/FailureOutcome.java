package com.eyelevel.documentcompressor.service.queue;

/**
 * What {@link CompressionQueue#failRetry} did with a failed job.
 */
public enum FailureOutcome {
    /**
     * The job went back to the queue and becomes eligible again after its backoff delay.
     */
    RETRY_SCHEDULED,
    /**
     * The job used up its attempts. It is failed and so is its document.
     */
    EXHAUSTED
}
