package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.InterruptedWhileWaitingException;
import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.exception.TaskInterruptedException;
import com.autonomous.pipeline.logging.MdcContext;
import com.autonomous.pipeline.model.JournalEvent;
import com.autonomous.pipeline.model.Phase;
import com.autonomous.pipeline.model.PipelineStep;
import com.autonomous.pipeline.model.ProjectConfig;
import com.autonomous.pipeline.model.RunOptions;
import com.autonomous.pipeline.model.StepLogs;
import com.autonomous.pipeline.model.StepPhase;
import com.autonomous.pipeline.model.TaskDefinition;
import com.autonomous.pipeline.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs every step of one task's pipeline in order. Steps already {@code done} are skipped,
 * so a task can be re-run safely after any interruption.
 */
@Slf4j
@Service
public class TaskRunnerService {

    private final ConfigLoaderService configLoader;
    private final PipelineValidator validator;
    private final PromptBuilderService promptBuilder;
    private final StepExecutorService stepExecutor;
    private final StateStoreService stateStore;
    private final GitService gitService;
    private final InterruptionHandler interruptionHandler;

    public TaskRunnerService(ConfigLoaderService configLoader,
                             PipelineValidator validator,
                             PromptBuilderService promptBuilder,
                             StepExecutorService stepExecutor,
                             StateStoreService stateStore,
                             GitService gitService,
                             InterruptionHandler interruptionHandler) {
        this.configLoader = configLoader;
        this.validator = validator;
        this.promptBuilder = promptBuilder;
        this.stepExecutor = stepExecutor;
        this.stateStore = stateStore;
        this.gitService = gitService;
        this.interruptionHandler = interruptionHandler;
    }

    public TaskStatus run(Path taskPath, RunOptions options) {
        return run(configLoader.load(), taskPath, options);
    }

    /**
     * Runs the task at {@code taskPath} (absolute, or relative to the project root) and returns
     * its final status.
     */
    public TaskStatus run(ProjectConfig config, Path taskPath, RunOptions options) {
        Path root = config.getProjectRoot();
        Path task = root.resolve(taskPath).toAbsolutePath().normalize();
        if (!Files.isRegularFile(task)) {
            throw new PipelineException("Task file not found: " + task);
        }

        TaskDefinition definition = promptBuilder.readTask(task);
        String pipelineName = resolvePipelineName(config, options, definition);
        validator.validate(config, pipelineName);
        List<PipelineStep> pipeline = config.getPipelines().get(pipelineName);

        String taskId = TaskIds.taskId(task, root);
        Path statusFile = stateStore.taskStatusFile(config.resolveStateDir(), taskId);
        TaskStatus existing = stateStore.readTask(statusFile);
        if (existing.getPhase() == Phase.DONE) {
            log.info("Task {} is already done. Nothing to run.", taskId);
            return existing;
        }

        MdcContext.setTask(taskId);
        String sequenceId = sequenceIdOf(options.getSequenceStatusFile());
        try {
            String branch = options.isSkipGitManagement()
                ? sequenceBranch(options.getSequenceStatusFile())
                : gitService.ensureTaskBranch(config, taskId);
            int autonomyLevel = definition.getAutonomyLevel() != null
                ? definition.getAutonomyLevel() : config.getAutonomyLevel();

            Instant now = stateStore.now();
            String relativeTaskPath = root.relativize(task).toString();
            stateStore.updateTask(statusFile, s -> {
                if (s.isNew()) {
                    s.setTaskId(taskId);
                    s.setStartTime(now);
                }
                s.setTaskPath(relativeTaskPath);
                s.setPipeline(pipelineName);
                if (branch != null) {
                    s.setBranch(branch);
                }
                if (sequenceId != null) {
                    s.setParentSequenceId(sequenceId);
                }
                for (PipelineStep step : pipeline) {
                    s.getSteps().putIfAbsent(step.getName(), StepPhase.PENDING);
                }
            });
            journal(config, JournalEvent.Type.TASK_STARTED, taskId, sequenceId, null);
            interruptionHandler.trackTask(statusFile);

            log.info("Running task {} with pipeline \"{}\"", relativeTaskPath, pipelineName);
            Path logsDir = config.resolveLogsDir().resolve(taskId);
            for (int i = 0; i < pipeline.size(); i++) {
                PipelineStep step = pipeline.get(i);
                TaskStatus current = stateStore.readTask(statusFile);
                if (current.isStepDone(step.getName())) {
                    log.info("Skipping '{}' (already done).", step.getName());
                    continue;
                }

                Map<String, String> context = promptBuilder.buildContext(pipeline, i, definition.getBody(),
                    current.getInteractionHistory(), root);
                String instructions = promptBuilder.readCommandInstructions(root, step.getCommand());
                String prompt = promptBuilder.assemblePrompt(pipeline, step.getName(), context, instructions,
                    autonomyLevel, options.getSequenceFolder());

                stepExecutor.execute(config, step, prompt, statusFile,
                    StepLogs.forStep(logsDir, i, step.getName()), options.getSequenceStatusFile());
            }

            TaskStatus done = stateStore.updateTask(statusFile, s -> {
                s.setPhase(Phase.DONE);
                s.setPendingQuestion(null);
                Instant started = s.getStartTime() != null ? s.getStartTime() : now;
                double seconds = Duration.between(started, stateStore.now()).toMillis() / 1000.0;
                s.getOrCreateStats().finish(seconds);
            });
            journal(config, JournalEvent.Type.TASK_FINISHED, taskId, sequenceId, Phase.DONE);
            log.info("All steps completed successfully!");
            return done;
        } catch (InterruptedWhileWaitingException e) {
            log.warn("Task {} is waiting for input. Re-run it to answer the pending question.", taskId);
            throw e;
        } catch (TaskInterruptedException e) {
            stateStore.updateTask(statusFile, s -> s.setPhase(Phase.INTERRUPTED));
            journal(config, JournalEvent.Type.TASK_FINISHED, taskId, sequenceId, Phase.INTERRUPTED);
            throw e;
        } catch (RuntimeException e) {
            TaskStatus failed = stateStore.updateTask(statusFile, s -> {
                if (s.getPhase() == Phase.RUNNING) {
                    s.setPhase(Phase.FAILED);
                }
            });
            journal(config, JournalEvent.Type.TASK_FINISHED, taskId, sequenceId, failed.getPhase());
            throw e;
        } finally {
            interruptionHandler.untrackTask();
            MdcContext.clearTask();
        }
    }

    /**
     * Pipeline priority: explicit option, task front matter, configured default, first defined.
     */
    String resolvePipelineName(ProjectConfig config, RunOptions options, TaskDefinition definition) {
        if (options.getPipeline() != null) {
            log.info("Using pipeline from option: \"{}\"", options.getPipeline());
            return options.getPipeline();
        }
        if (definition.getPipeline() != null) {
            log.info("Using pipeline from task front matter: \"{}\"", definition.getPipeline());
            return definition.getPipeline();
        }
        if (config.getDefaultPipeline() != null) {
            log.info("Using default pipeline: \"{}\"", config.getDefaultPipeline());
            return config.getDefaultPipeline();
        }
        return config.getPipelines().isEmpty() ? null : config.getPipelines().keySet().iterator().next();
    }

    private String sequenceIdOf(Path sequenceStatusFile) {
        if (sequenceStatusFile == null) {
            return null;
        }
        return stateStore.readSequence(sequenceStatusFile).getSequenceId();
    }

    private String sequenceBranch(Path sequenceStatusFile) {
        if (sequenceStatusFile == null) {
            return null;
        }
        return stateStore.readSequence(sequenceStatusFile).getBranch();
    }

    private void journal(ProjectConfig config, JournalEvent.Type type, String id, String parentId, Phase status) {
        stateStore.logJournalEvent(config.resolveStateDir(), JournalEvent.builder()
            .eventType(type)
            .id(id)
            .parentId(parentId)
            .status(status)
            .build());
    }
}
