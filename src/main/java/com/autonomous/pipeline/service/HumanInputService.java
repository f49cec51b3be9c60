package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.InterruptedWhileWaitingException;
import com.autonomous.pipeline.model.Interaction;
import com.autonomous.pipeline.model.Phase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Obtains a human answer to a question the agent raised.
 *
 * <p>The console prompt and the answer-file watcher race; the first answer wins and the other
 * listener is cancelled before this method returns, so repeated questions within one step never
 * leave a live listener behind.
 */
@Slf4j
@Service
public class HumanInputService {

    private final StateStoreService stateStore;
    private final AnswerSource consoleSource;
    private final AnswerSource fileSource;

    @Autowired
    public HumanInputService(StateStoreService stateStore,
                             ConsoleAnswerSource consoleSource,
                             AnswerFileWatcher fileSource) {
        this(stateStore, (AnswerSource) consoleSource, (AnswerSource) fileSource);
    }

    HumanInputService(StateStoreService stateStore, AnswerSource consoleSource, AnswerSource fileSource) {
        this.stateStore = stateStore;
        this.consoleSource = consoleSource;
        this.fileSource = fileSource;
    }

    /**
     * Blocks until the question is answered, then moves it into the task's interaction history,
     * puts the task (and sequence, if any) back to {@code running} and books the pause time.
     * The task must already be recorded as {@code waiting_for_input}.
     *
     * @throws InterruptedWhileWaitingException if the user cancels; the task stays parked on the question
     */
    public String awaitAnswer(Path statusFile, String taskId, String question, Path sequenceStatusFile) {
        Path stateDir = statusFile.toAbsolutePath().getParent();
        Instant pauseStart = stateStore.now();
        log.info("Waiting for an answer to: {}", question);

        CompletableFuture<String> console = consoleSource.listen(stateDir, taskId, question);
        CompletableFuture<String> file = fileSource.listen(stateDir, taskId, question);
        String answer;
        try {
            answer = (String) CompletableFuture.anyOf(console, file).get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof InterruptedWhileWaitingException) {
                throw (InterruptedWhileWaitingException) e.getCause();
            }
            throw new InterruptedWhileWaitingException("Answer channel failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedWhileWaitingException("Interrupted while waiting for an answer", e);
        } finally {
            console.cancel(true);
            file.cancel(true);
        }

        Instant answeredAt = stateStore.now();
        double pauseSeconds = Duration.between(pauseStart, answeredAt).toMillis() / 1000.0;

        stateStore.updateTask(statusFile, s -> {
            s.getInteractionHistory().add(new Interaction(question, answer, answeredAt));
            s.setPendingQuestion(null);
            s.setPhase(Phase.RUNNING);
            s.getOrCreateStats().addPause(pauseSeconds);
        });
        if (sequenceStatusFile != null) {
            stateStore.updateSequence(sequenceStatusFile, s -> {
                s.setPhase(Phase.RUNNING);
                s.getOrCreateStats().addPause(pauseSeconds);
            });
        }
        log.info("Answer received after {}s. Resuming.", String.format("%.1f", pauseSeconds));
        return answer;
    }
}
