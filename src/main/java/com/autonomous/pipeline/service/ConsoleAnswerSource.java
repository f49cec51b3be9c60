package com.autonomous.pipeline.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Interactive prompt on the terminal.
 *
 * <p>A blocking read on stdin cannot be cancelled, so a single pump thread reads lines into a
 * queue for the lifetime of the process and each question gets its own cancellable poller on
 * that queue. Lines typed while no question is open are discarded when the next one opens.
 * Once input is closed the console stops reading and its answer never arrives, which leaves the
 * answer file as the only way to respond.
 */
@Slf4j
@Component
public class ConsoleAnswerSource implements AnswerSource {

    private static final long POLL_MILLIS = 100;

    private final InputStream input;
    private final PrintStream out;
    private final BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();
    private final ExecutorService pollers = Executors.newCachedThreadPool(daemon("answer-prompt"));

    private Thread pump;
    private volatile boolean endOfInput;

    public ConsoleAnswerSource() {
        this(System.in, System.out);
    }

    public ConsoleAnswerSource(InputStream input, PrintStream out) {
        this.input = input;
        this.out = out;
    }

    @Override
    public CompletableFuture<String> listen(Path stateDir, String taskId, String question) {
        startPump();
        discardStaleInput();

        out.println();
        out.println("[Orchestrator] Task has been paused. The AI needs your input.");
        out.println();
        out.println("QUESTION:");
        out.println(question);
        out.println();
        out.println("(You can answer here, or drop an answer file at "
            + stateDir.resolve(taskId + ".answer") + ")");
        out.print("Your answer: ");
        out.flush();

        CompletableFuture<String> result = new CompletableFuture<>();
        if (endOfInput) {
            announceClosedInput();
            return result;
        }

        Future<?> poller = pollers.submit(() -> {
            try {
                while (!result.isDone()) {
                    Optional<String> line = lines.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    if (line == null) {
                        continue;
                    }
                    if (line.isEmpty()) {
                        endOfInput = true;
                        announceClosedInput();
                        return;
                    } else {
                        result.complete(line.get().trim());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        result.whenComplete((answer, error) -> poller.cancel(true));
        return result;
    }

    private void announceClosedInput() {
        out.println();
        out.println("[Orchestrator] Console input is closed. Waiting for the answer file instead.");
        out.flush();
        log.info("Console input is closed; only the answer file can answer this question");
    }

    private synchronized void startPump() {
        if (pump != null) {
            return;
        }
        pump = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lines.add(Optional.of(line));
                }
            } catch (IOException e) {
                log.warn("Console input failed: {}", e.getMessage());
            }
            lines.add(Optional.empty());
        }, "console-input");
        pump.setDaemon(true);
        pump.start();
    }

    private void discardStaleInput() {
        Optional<String> stale;
        while ((stale = lines.poll()) != null) {
            if (stale.isEmpty()) {
                endOfInput = true;
            } else {
                log.debug("Ignoring input typed while no question was open: {}", stale.get());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        pollers.shutdownNow();
    }

    static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
