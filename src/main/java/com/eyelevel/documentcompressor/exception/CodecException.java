package com.eyelevel.documentcompressor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * A recoverable failure of a codec invocation. The worker feeds it into the job's retry accounting.
 */
@Getter
public class CodecException extends Exception {
    @Serial
    private static final long serialVersionUID = -4470198165260386114L;

    public enum Kind {
        UNSUPPORTED,
        CORRUPT_INPUT,
        IO_ERROR,
        TIMEOUT
    }

    private final Kind kind;

    public CodecException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CodecException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * The message persisted on the job, prefixed with the failure kind.
     */
    public String describe() {
        return kind + ": " + getMessage();
    }
}
