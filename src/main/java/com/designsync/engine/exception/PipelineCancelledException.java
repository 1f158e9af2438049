package com.designsync.engine.exception;

public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
