package com.autonomous.pipeline.exception;

import java.time.Instant;

public class RateLimitReachedException extends PipelineException {

    private final Instant resetTime;

    public RateLimitReachedException(Instant resetTime) {
        super(String.format("Workflow failed: agent usage limit reached. Your limit will reset at %s.%n"
            + "To wait and resume automatically, set 'wait_for_rate_limit_reset: true' in the project config.%n"
            + "You can re-run the command after the reset time to continue from this step.", resetTime));
        this.resetTime = resetTime;
    }

    public Instant getResetTime() {
        return resetTime;
    }
}
