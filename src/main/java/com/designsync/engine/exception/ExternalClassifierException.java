package com.designsync.engine.exception;

/**
 * Failure of the external classifier transport or an unusable answer.
 */
public class ExternalClassifierException extends RuntimeException {

    public ExternalClassifierException(String message) {
        super(message);
    }

    public ExternalClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
