package com.autonomous.pipeline.service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * One channel a human answer can arrive through.
 */
public interface AnswerSource {

    /**
     * Starts listening for the answer to {@code question}. The returned future completes with
     * the answer, or exceptionally if the channel is closed by the user. Cancelling the future
     * stops the listener and releases whatever it holds.
     */
    CompletableFuture<String> listen(Path stateDir, String taskId, String question);
}
