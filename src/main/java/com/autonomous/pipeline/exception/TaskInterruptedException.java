package com.autonomous.pipeline.exception;

public class TaskInterruptedException extends PipelineException {

    public TaskInterruptedException(String message) {
        super(message);
    }
}
