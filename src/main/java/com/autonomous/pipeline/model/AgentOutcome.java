package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of one agent invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentOutcome {

    public enum Kind {
        SUCCESS,
        FAILURE,
        INTERVENTION_REQUESTED,
        RATE_LIMITED
    }

    private Kind kind;
    private int exitCode;
    private String output;
    private String question;
    private Instant resetTime;
    @Builder.Default
    private TokenUsage tokenUsage = new TokenUsage();
    private String modelUsed;
    private Path logFile;
    private Path reasoningLogFile;
}
