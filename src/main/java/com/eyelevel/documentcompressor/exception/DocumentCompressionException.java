package com.eyelevel.documentcompressor.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the document compression pipeline.
 */
public class DocumentCompressionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 6126584031940775208L;

    public DocumentCompressionException(String message) {
        super(message);
    }

    public DocumentCompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
