package com.eyelevel.documentcompressor.exception;

import java.io.Serial;

/**
 * Thrown when a document, job or document type cannot be found.
 */
public class DocumentNotFoundException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = 5533901873624117032L;

    public DocumentNotFoundException(String message) {
        super(message);
    }
}
