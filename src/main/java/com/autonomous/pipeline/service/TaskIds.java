package com.autonomous.pipeline.service;

import java.nio.file.Path;

/**
 * Deterministic identifiers derived from task and sequence paths.
 */
public final class TaskIds {

    private static final String TASK_PREFIX = "task-";
    private static final String SEQUENCE_PREFIX = "sequence-";

    private TaskIds() {}

    /**
     * {@code tasks/feature/01-add-login.md} becomes {@code task-tasks-feature-01-add-login}.
     */
    public static String taskId(Path taskPath, Path projectRoot) {
        Path relative = taskPath.isAbsolute()
            ? projectRoot.toAbsolutePath().normalize().relativize(taskPath.normalize())
            : taskPath.normalize();
        String withoutExtension = relative.toString().replaceAll("\\.md$", "");
        return TASK_PREFIX + withoutExtension
            .replaceAll("[\\\\/]", "-")
            .replaceAll("[^A-Za-z0-9-]", "-");
    }

    public static String sequenceId(Path folderPath) {
        String folderName = folderPath.toAbsolutePath().normalize().getFileName().toString();
        return SEQUENCE_PREFIX + folderName.replaceAll("[^A-Za-z0-9-]", "-");
    }

    public static String taskBranch(String prefix, String taskId) {
        String segment = taskId.startsWith(TASK_PREFIX) ? taskId.substring(TASK_PREFIX.length()) : taskId;
        return String.format("%s/%s", prefix, segment);
    }

    public static String sequenceBranch(String prefix, String sequenceId) {
        return String.format("%s/%s", prefix, sequenceId);
    }
}
