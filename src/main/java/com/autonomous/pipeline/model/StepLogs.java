package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Log files of one pipeline step.
 */
@Data
@AllArgsConstructor
public class StepLogs {
    private Path logFile;
    private Path reasoningLogFile;
    private Path rawJsonLogFile;

    public static StepLogs forStep(Path logsDir, int index, String stepName) {
        String prefix = String.format("%02d-%s", index + 1, stepName);
        return new StepLogs(
            logsDir.resolve(prefix + ".log"),
            logsDir.resolve(prefix + ".reasoning.log"),
            logsDir.resolve(prefix + ".raw.json.log"));
    }
}
