package com.autonomous.pipeline.exception;

/**
 * The user cancelled while a question was pending. The task stays in
 * {@code waiting_for_input} so a later run can pick the question up again.
 */
public class InterruptedWhileWaitingException extends PipelineException {

    public InterruptedWhileWaitingException(String message) {
        super(message);
    }

    public InterruptedWhileWaitingException(String message, Throwable cause) {
        super(message, cause);
    }
}
