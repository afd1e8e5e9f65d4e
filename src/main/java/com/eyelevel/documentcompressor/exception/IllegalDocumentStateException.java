package com.eyelevel.documentcompressor.exception;

import java.io.Serial;

/**
 * Thrown when a document is not in a compression state that permits the requested operation.
 */
public class IllegalDocumentStateException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = -1450977310628453019L;

    public IllegalDocumentStateException(String message) {
        super(message);
    }
}
