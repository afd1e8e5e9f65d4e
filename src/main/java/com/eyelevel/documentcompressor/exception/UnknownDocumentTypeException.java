package com.eyelevel.documentcompressor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a document references a type id that has no registered compression policy.
 */
@Getter
public class UnknownDocumentTypeException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = 3390725104871126543L;

    private final String typeId;

    public UnknownDocumentTypeException(String typeId) {
        super("Unknown document type: " + typeId);
        this.typeId = typeId;
    }
}
