package com.eyelevel.documentcompressor.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.UUID;

/**
 * Thrown when a document already has a queued or running compression job.
 */
@Getter
public class DuplicateJobException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = -6673409248517723161L;

    private final UUID documentId;

    public DuplicateJobException(UUID documentId) {
        super("Document " + documentId + " already has an active compression job.");
        this.documentId = documentId;
    }

    public DuplicateJobException(UUID documentId, Throwable cause) {
        super("Document " + documentId + " already has an active compression job.", cause);
        this.documentId = documentId;
    }
}
