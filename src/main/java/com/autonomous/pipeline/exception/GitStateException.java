package com.autonomous.pipeline.exception;

public class GitStateException extends PipelineException {

    public GitStateException(String message) {
        super(message);
    }
}
