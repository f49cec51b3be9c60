package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.PipelineException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the state directory for an answer file dropped by an external actor such as a UI.
 */
@Slf4j
@Component
public class AnswerFileWatcher implements AnswerSource {

    @Value("${agent.answer.poll-interval-ms:1000}")
    private long pollIntervalMs = 1000;

    private final StateStoreService stateStore;
    private final ScheduledExecutorService scheduler =
        Executors.newSingleThreadScheduledExecutor(ConsoleAnswerSource.daemon("answer-file-watcher"));

    public AnswerFileWatcher(StateStoreService stateStore) {
        this.stateStore = stateStore;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public CompletableFuture<String> listen(Path stateDir, String taskId, String question) {
        CompletableFuture<String> result = new CompletableFuture<>();
        ScheduledFuture<?> poll = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            try {
                stateStore.readAndDeleteAnswer(stateDir, taskId).ifPresent(answer -> {
                    if (result.complete(answer)) {
                        log.info("Answer received from answer file. Resuming...");
                    } else {
                        log.warn("Answer file for {} arrived after the question was answered; ignoring it", taskId);
                    }
                });
            } catch (PipelineException e) {
                log.warn("Could not read answer file for {}: {}", taskId, e.getMessage());
            }
        }, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
        result.whenComplete((answer, error) -> poll.cancel(false));
        return result;
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
