package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.ConfigurationException;
import com.autonomous.pipeline.model.CheckConfig;
import com.autonomous.pipeline.model.PipelineStep;
import com.autonomous.pipeline.model.ProjectConfig;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-flight validation of pipeline definitions. Runs before any git or agent work and
 * reports every problem at once.
 */
@Service
public class PipelineValidator {

    static final int MAX_AUTONOMY_LEVEL = 5;

    private final PromptBuilderService promptBuilder;

    public PipelineValidator(PromptBuilderService promptBuilder) {
        this.promptBuilder = promptBuilder;
    }

    /**
     * @param selectedPipeline pipeline about to run, or {@code null} to validate all of them only
     * @throws ConfigurationException listing every problem found
     */
    public void validate(ProjectConfig config, String selectedPipeline) {
        List<String> errors = new ArrayList<>();

        if (config.getAutonomyLevel() < 0 || config.getAutonomyLevel() > MAX_AUTONOMY_LEVEL) {
            errors.add(String.format("autonomy_level must be between 0 and %d, got %d.",
                MAX_AUTONOMY_LEVEL, config.getAutonomyLevel()));
        }

        Map<String, List<PipelineStep>> pipelines = config.getPipelines();
        if (pipelines == null || pipelines.isEmpty()) {
            errors.add("No pipelines are defined.");
        } else {
            if (selectedPipeline != null && !pipelines.containsKey(selectedPipeline)) {
                errors.add(String.format("Pipeline \"%s\" not found. Available: %s",
                    selectedPipeline, String.join(", ", pipelines.keySet())));
            }
            pipelines.forEach((name, steps) -> validatePipeline(config, name, steps, errors));
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Pipeline configuration is invalid:", errors);
        }
    }

    private void validatePipeline(ProjectConfig config, String pipelineName, List<PipelineStep> steps,
                                  List<String> errors) {
        if (steps == null || steps.isEmpty()) {
            errors.add(String.format("Pipeline '%s' has no steps.", pipelineName));
            return;
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            String where = String.format("Pipeline '%s', step %d", pipelineName, i + 1);
            if (step == null) {
                errors.add(where + " is empty.");
                continue;
            }
            if (isBlank(step.getName())) {
                errors.add(where + " is missing a 'name'.");
            } else {
                where = String.format("Pipeline '%s', step '%s'", pipelineName, step.getName());
                if (!names.add(step.getName())) {
                    errors.add(where + ": duplicate step name.");
                }
            }

            if (isBlank(step.getCommand())) {
                errors.add(where + " is missing a 'command'.");
            } else if (!Files.exists(promptBuilder.resolveCommandFile(config.getProjectRoot(), step.getCommand()))) {
                errors.add(String.format("%s: command file not found at %s", where,
                    promptBuilder.resolveCommandFile(config.getProjectRoot(), step.getCommand())));
            }

            if (step.getRetry() != null && step.getRetry() < 0) {
                errors.add(where + ": 'retry' must be a non-negative integer.");
            }

            if (step.getCheck() == null || step.getCheck().isEmpty()) {
                errors.add(where + " is missing a 'check'. Use type 'none' for steps without validation.");
            } else {
                for (CheckConfig check : step.getCheck()) {
                    validateCheck(where, check, errors);
                }
            }

            if (step.getFileAccess() != null && step.getFileAccess().getAllowWrite() != null) {
                for (String pattern : step.getFileAccess().getAllowWrite()) {
                    validateGlob(where, pattern, errors);
                }
            }
        }
    }

    private void validateCheck(String where, CheckConfig check, List<String> errors) {
        if (check == null || check.getType() == null) {
            errors.add(where + ": check is missing its 'type'.");
            return;
        }
        switch (check.getType()) {
            case FILE_EXISTS -> {
                if (isBlank(check.getPath())) {
                    errors.add(where + ": check type 'fileExists' requires a 'path'.");
                }
            }
            case SHELL -> {
                if (isBlank(check.getCommand())) {
                    errors.add(where + ": check type 'shell' requires a 'command'.");
                }
            }
            case NONE -> { }
        }
    }

    private void validateGlob(String where, String pattern, List<String> errors) {
        if (isBlank(pattern)) {
            errors.add(where + ": 'allow_write' contains an empty pattern.");
            return;
        }
        try {
            FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        } catch (IllegalArgumentException e) {
            errors.add(String.format("%s: invalid 'allow_write' glob \"%s\": %s", where, pattern, e.getMessage()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
