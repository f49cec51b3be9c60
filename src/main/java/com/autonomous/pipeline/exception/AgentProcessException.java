package com.autonomous.pipeline.exception;

import java.nio.file.Path;

/**
 * The agent exited unsuccessfully without asking for help. Carries the logs to look at.
 */
public class AgentProcessException extends PipelineException {

    private final Path logFile;
    private final Path reasoningLogFile;

    public AgentProcessException(String message, Path logFile, Path reasoningLogFile) {
        super(String.format("%s%nCheck the output log for details: %s%nAnd the reasoning log: %s",
            message, logFile, reasoningLogFile));
        this.logFile = logFile;
        this.reasoningLogFile = reasoningLogFile;
    }

    public AgentProcessException(String message, Throwable cause) {
        super(message, cause);
        this.logFile = null;
        this.reasoningLogFile = null;
    }

    public Path getLogFile() {
        return logFile;
    }

    public Path getReasoningLogFile() {
        return reasoningLogFile;
    }
}
