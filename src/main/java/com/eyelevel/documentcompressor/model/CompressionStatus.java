package com.eyelevel.documentcompressor.model;

import java.util.Set;

/**
 * Defines the possible compression states of a {@link MediaDocument}.
 */
public enum CompressionStatus {
    /**
     * The document has been registered and is waiting for its compression job to be claimed.
     */
    PENDING,
    /**
     * A worker has claimed the document's job. The document stays here between retry attempts.
     */
    PROCESSING,
    /**
     * A compressed artifact was written and is referenced by the document.
     */
    COMPLETED,
    /**
     * All compression attempts were exhausted.
     */
    FAILED,
    /**
     * Compression was deliberately not performed (below threshold, disabled, unsupported type or not effective).
     */
    SKIPPED;

    public static final Set<CompressionStatus> TERMINAL = Set.of(COMPLETED, FAILED, SKIPPED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
