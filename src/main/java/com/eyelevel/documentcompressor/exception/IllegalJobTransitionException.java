package com.eyelevel.documentcompressor.exception;

import java.io.Serial;

/**
 * Thrown when a compression job is asked to make a transition its current state does not allow.
 */
public class IllegalJobTransitionException extends DocumentCompressionException {
    @Serial
    private static final long serialVersionUID = 8209335647910284412L;

    public IllegalJobTransitionException(String message) {
        super(message);
    }
}
