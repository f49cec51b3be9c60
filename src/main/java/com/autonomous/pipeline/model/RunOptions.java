package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Per-run options of a task. Sequence fields are set when the task runs inside a sequence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunOptions {
    private String pipeline;
    private boolean skipGitManagement;
    private Path sequenceStatusFile;
    private Path sequenceFolder;

    public static RunOptions defaults() {
        return new RunOptions();
    }
}
