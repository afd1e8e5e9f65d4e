package com.eyelevel.documentcompressor.exception;

import java.io.Serial;

/**
 * Thrown when document metadata or a document-type definition is malformed.
 */
public class DocumentValidationException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = -2871945092133178420L;

    public DocumentValidationException(String message) {
        super(message);
    }
}
