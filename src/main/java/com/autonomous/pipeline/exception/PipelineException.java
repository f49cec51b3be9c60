package com.autonomous.pipeline.exception;

/**
 * Base of every error raised while running tasks and sequences.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
