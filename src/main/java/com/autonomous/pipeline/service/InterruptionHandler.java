package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.model.Phase;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Marks the running task and sequence {@code interrupted} when the JVM is stopped mid-run,
 * after killing the agent process. A task parked on a question keeps its
 * {@code waiting_for_input} phase so the next run can pick the question up.
 */
@Slf4j
@Component
public class InterruptionHandler {

    private final StateStoreService stateStore;
    private final ClaudeAgentService agentService;

    private volatile Path taskStatusFile;
    private volatile Path sequenceStatusFile;
    private volatile boolean interrupted;
    private Thread hook;

    public InterruptionHandler(StateStoreService stateStore, ClaudeAgentService agentService) {
        this.stateStore = stateStore;
        this.agentService = agentService;
    }

    @PostConstruct
    public void install() {
        hook = new Thread(this::onShutdown, "pipeline-interrupt");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    @PreDestroy
    public void uninstall() {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook runs or has run
            log.debug("Shutdown in progress, interruption hook stays registered");
        }
    }

    public void trackTask(Path statusFile) {
        this.taskStatusFile = statusFile;
    }

    public void untrackTask() {
        this.taskStatusFile = null;
    }

    public void trackSequence(Path statusFile) {
        this.sequenceStatusFile = statusFile;
    }

    public void untrackSequence() {
        this.sequenceStatusFile = null;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    void onShutdown() {
        interrupted = true;
        Path task = taskStatusFile;
        Path sequence = sequenceStatusFile;
        if (task == null && sequence == null) {
            return;
        }
        log.warn("Interrupted. Stopping the agent and saving state...");
        agentService.killActiveProcess();

        try {
            if (task != null && shouldMark(stateStore.readTask(task).getPhase())) {
                stateStore.updateTask(task, s -> s.setPhase(Phase.INTERRUPTED));
                log.info("Task marked as interrupted: {}", task.getFileName());
            }
            if (sequence != null && shouldMark(stateStore.readSequence(sequence).getPhase())) {
                stateStore.updateSequence(sequence, s -> s.setPhase(Phase.INTERRUPTED));
                log.info("Sequence marked as interrupted: {}", sequence.getFileName());
            }
        } catch (PipelineException e) {
            log.error("Could not record interruption: {}", e.getMessage());
        }
    }

    private static boolean shouldMark(Phase phase) {
        return !phase.isTerminal() && phase != Phase.WAITING_FOR_INPUT && phase != Phase.INTERRUPTED;
    }
}
