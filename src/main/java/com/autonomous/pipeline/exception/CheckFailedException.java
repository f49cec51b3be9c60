package com.autonomous.pipeline.exception;

public class CheckFailedException extends PipelineException {

    private final String stepName;
    private final String checkOutput;

    public CheckFailedException(String stepName, int retries, String checkOutput) {
        super(String.format("Step \"%s\" failed after %d retries. Final check error: %s",
            stepName, retries, checkOutput == null ? "Check validation failed" : checkOutput));
        this.stepName = stepName;
        this.checkOutput = checkOutput;
    }

    public String getStepName() {
        return stepName;
    }

    public String getCheckOutput() {
        return checkOutput;
    }
}
