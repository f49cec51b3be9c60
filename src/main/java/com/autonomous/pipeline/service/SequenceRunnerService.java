package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.InterruptedWhileWaitingException;
import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.exception.TaskInterruptedException;
import com.autonomous.pipeline.logging.MdcContext;
import com.autonomous.pipeline.model.JournalEvent;
import com.autonomous.pipeline.model.Phase;
import com.autonomous.pipeline.model.ProjectConfig;
import com.autonomous.pipeline.model.RunOptions;
import com.autonomous.pipeline.model.SequenceStatus;
import com.autonomous.pipeline.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the task files of a folder one at a time on a single branch.
 *
 * <p>The folder is listed again after every task, so a task may add further task files
 * for the sequence to pick up. Files are taken in filename order; names starting with
 * {@code _} are ignored.
 */
@Slf4j
@Service
public class SequenceRunnerService {

    private final ConfigLoaderService configLoader;
    private final PipelineValidator validator;
    private final TaskRunnerService taskRunner;
    private final StateStoreService stateStore;
    private final GitService gitService;
    private final InterruptionHandler interruptionHandler;

    public SequenceRunnerService(ConfigLoaderService configLoader,
                                 PipelineValidator validator,
                                 TaskRunnerService taskRunner,
                                 StateStoreService stateStore,
                                 GitService gitService,
                                 InterruptionHandler interruptionHandler) {
        this.configLoader = configLoader;
        this.validator = validator;
        this.taskRunner = taskRunner;
        this.stateStore = stateStore;
        this.gitService = gitService;
        this.interruptionHandler = interruptionHandler;
    }

    /**
     * @param folderPath task folder, or {@code null} for the configured {@code task_folder}
     */
    public SequenceStatus run(Path folderPath) {
        ProjectConfig config = configLoader.load();
        return run(config, folderPath != null ? folderPath : Paths.get(config.getTaskFolder()));
    }

    public SequenceStatus run(ProjectConfig config, Path folderPath) {
        Path root = config.getProjectRoot();
        Path folder = root.resolve(folderPath).toAbsolutePath().normalize();
        if (!Files.isDirectory(folder)) {
            throw new PipelineException("Folder does not exist or cannot be accessed: " + folderPath);
        }
        if (listTaskFiles(folder).isEmpty()) {
            throw new PipelineException("No task files (.md) found in folder: " + folderPath);
        }
        validator.validate(config, null);

        String sequenceId = TaskIds.sequenceId(folder);
        Path statusFile = stateStore.sequenceStatusFile(config.resolveStateDir(), sequenceId);
        Path relativeFolder = root.relativize(folder);

        MdcContext.setSequence(sequenceId);
        try {
            SequenceStatus existing = stateStore.readSequence(statusFile);
            if (existing.getPhase() == Phase.INTERRUPTED || existing.getPhase() == Phase.FAILED) {
                log.info("Resuming sequence \"{}\" ({} tasks already completed)",
                    sequenceId, existing.getCompletedTasks().size());
            }

            String branch = gitService.ensureSequenceBranch(config, sequenceId);
            Instant now = stateStore.now();
            stateStore.updateSequence(statusFile, s -> {
                if (s.isNew()) {
                    s.setSequenceId(sequenceId);
                    s.setStartTime(now);
                }
                s.setBranch(branch);
                s.setPhase(Phase.RUNNING);
                s.getOrCreateStats();
            });
            journal(config, JournalEvent.Type.SEQUENCE_STARTED, sequenceId, null);
            interruptionHandler.trackSequence(statusFile);

            RunOptions options = RunOptions.builder()
                .skipGitManagement(true)
                .sequenceStatusFile(statusFile)
                .sequenceFolder(relativeFolder)
                .build();

            Optional<Path> next;
            while ((next = findNextTask(folder, statusFile, root)).isPresent()) {
                Path task = next.get();
                String relativeTask = root.relativize(task).toString();
                log.info("Starting task: {}", relativeTask);
                stateStore.updateSequence(statusFile, s -> s.setCurrentTaskPath(relativeTask));

                try {
                    taskRunner.run(config, task, options);
                } catch (InterruptedWhileWaitingException e) {
                    throw e;
                } catch (RuntimeException e) {
                    Phase phase = e instanceof TaskInterruptedException || interruptionHandler.isInterrupted()
                        ? Phase.INTERRUPTED : Phase.FAILED;
                    stateStore.updateSequence(statusFile, s -> s.setPhase(phase));
                    journal(config, JournalEvent.Type.SEQUENCE_FINISHED, sequenceId, phase);
                    log.error("Sequence halted: task {} did not complete", relativeTask);
                    throw e;
                }

                stateStore.updateSequence(statusFile, s -> {
                    if (!s.getCompletedTasks().contains(relativeTask)) {
                        s.getCompletedTasks().add(relativeTask);
                    }
                    s.setCurrentTaskPath(null);
                });
                Map<String, TokenUsage> usage = rollUpTokenUsage(config, root, statusFile);
                stateStore.updateSequence(statusFile, s -> s.getOrCreateStats().setTotalTokenUsage(usage));
                log.info("Task completed: {}", relativeTask);
            }

            SequenceStatus done = stateStore.updateSequence(statusFile, s -> {
                s.setPhase(Phase.DONE);
                s.setCurrentTaskPath(null);
                Instant started = s.getStartTime() != null ? s.getStartTime() : now;
                s.getOrCreateStats().finish(Duration.between(started, stateStore.now()).toMillis() / 1000.0);
            });
            journal(config, JournalEvent.Type.SEQUENCE_FINISHED, sequenceId, Phase.DONE);
            log.info("All tasks in sequence \"{}\" completed successfully!", sequenceId);
            return done;
        } finally {
            interruptionHandler.untrackSequence();
            MdcContext.clear();
        }
    }

    /**
     * First task file in filename order that the sequence has not completed yet.
     */
    Optional<Path> findNextTask(Path folder, Path statusFile, Path root) {
        List<String> completed = stateStore.readSequence(statusFile).getCompletedTasks();
        return listTaskFiles(folder).stream()
            .filter(task -> !completed.contains(root.relativize(task).toString()))
            .findFirst();
    }

    List<Path> listTaskFiles(Path folder) {
        try (Stream<Path> files = Files.list(folder)) {
            return files
                .filter(Files::isRegularFile)
                .filter(file -> {
                    String name = file.getFileName().toString();
                    return name.endsWith(".md") && !name.startsWith("_");
                })
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PipelineException("Could not list task folder " + folder, e);
        }
    }

    /**
     * Sequence totals are recomputed from the completed tasks' records each time, so a task that
     * failed and was re-run is counted once, with the usage of all its attempts.
     */
    private Map<String, TokenUsage> rollUpTokenUsage(ProjectConfig config, Path root, Path statusFile) {
        Path stateDir = config.resolveStateDir();
        Map<String, TokenUsage> totals = new LinkedHashMap<>();
        for (String relativeTask : stateStore.readSequence(statusFile).getCompletedTasks()) {
            String taskId = TaskIds.taskId(root.resolve(relativeTask).normalize(), root);
            TokenUsage.mergeAll(totals, stateStore.readTask(stateStore.taskStatusFile(stateDir, taskId)).getTokenUsage());
        }
        return totals;
    }

    private void journal(ProjectConfig config, JournalEvent.Type type, String id, Phase status) {
        stateStore.logJournalEvent(config.resolveStateDir(), JournalEvent.builder()
            .eventType(type)
            .id(id)
            .status(status)
            .build());
    }
}
