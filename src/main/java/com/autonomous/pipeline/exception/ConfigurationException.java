package com.autonomous.pipeline.exception;

import java.util.List;

public class ConfigurationException extends PipelineException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(message, List.of());
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public ConfigurationException(String message, List<String> errors) {
        super(errors.isEmpty() ? message : message + "\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
