package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.AgentProcessException;
import com.autonomous.pipeline.model.AgentOutcome;
import com.autonomous.pipeline.model.StepLogs;
import com.autonomous.pipeline.model.TokenUsage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Spawns the external agent for one attempt of a step and turns its event stream into
 * an {@link AgentOutcome}. Only one agent process is active at a time.
 */
@Slf4j
@Service
public class ClaudeAgentService {

    private static final String SEPARATOR = "=================================================";
    private static final DateTimeFormatter LINE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Value("${claude.code.path:claude}")
    private String claudeCodePath;

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<Process> activeProcess = new AtomicReference<>();

    public void setClaudeCodePath(String claudeCodePath) {
        this.claudeCodePath = claudeCodePath;
    }

    /**
     * Runs the agent with {@code prompt} on stdin and blocks until it exits.
     *
     * <p>A human-input request wins over the exit code: the process is stopped as soon as the
     * request is seen and the outcome carries the question. A usage-limit signal is reported
     * as {@link AgentOutcome.Kind#RATE_LIMITED} regardless of the exit code.
     */
    public AgentOutcome invoke(String prompt, Path cwd, String model, StepLogs logs) {
        List<String> command = buildCommand(model);
        Instant startTime = Instant.now();
        log.info("Spawning agent: {} (logs: {})", String.join(" ", command), logs.getLogFile());

        try (StepLogWriter writer = StepLogWriter.open(logs)) {
            String header = String.format("%n%s%n--- Log started at: %s ---%n--- Working directory: %s ---%n--- Command: %s ---%n",
                SEPARATOR, startTime, cwd, String.join(" ", command));
            writer.main(header);
            writer.reasoning(header);
            writer.reasoning("--- This file contains the agent's step-by-step reasoning process ---\n");
            writer.main("\n--- PROMPT DATA ---\n" + prompt + "\n--- END PROMPT DATA ---\n\n");

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(cwd.toFile());
            Process process = pb.start();
            activeProcess.set(process);

            AgentStreamParser parser = new AgentStreamParser(mapper, new AgentStreamParser.Listener() {
                @Override
                public void onRawLine(String line) {
                    writer.raw(line + "\n");
                }

                @Override
                public void onContent(String text) {
                    writer.main(text);
                }

                @Override
                public void onReasoning(String type, String subtype, String content) {
                    writer.reasoning(String.format("[%s] [%s] [%s] %s%n", lineTimestamp(),
                        type.toUpperCase(), subtype.toUpperCase(), content));
                }

                @Override
                public void onHumanInputRequested(String question) {
                    log.info("Agent requested human input: {}", question);
                    process.destroy();
                }
            });

            Thread stderrPump = pumpStderr(process, writer);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // The agent may exit before reading stdin; its exit code tells the story
                log.debug("Could not write prompt to agent stdin: {}", e.getMessage());
            }
            writer.reasoning(String.format("[%s] [PROCESS-DEBUG] Stdin data written and closed%n%n", lineTimestamp()));

            try (Reader stdout = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
                char[] buffer = new char[8192];
                int read;
                while ((read = stdout.read(buffer)) != -1) {
                    parser.accept(new String(buffer, 0, read));
                }
            } catch (IOException e) {
                // Raised when the stream closes under us after process.destroy()
                log.debug("Agent stdout closed: {}", e.getMessage());
            }
            parser.finish();

            int exitCode = process.waitFor();
            stderrPump.join();
            activeProcess.compareAndSet(process, null);

            TokenUsage usage = parser.getTokenUsage();
            Instant endTime = Instant.now();
            String trailer = String.format("%n%n-------------------------------------------------%n"
                    + "--- Process finished at: %s ---%n--- Duration: %.2fs, Exit Code: %d ---%n"
                    + "--- Token Usage ---%n--- Input: %d, Output: %d, Cache creation: %d, Cache read: %d ---%n",
                endTime, Duration.between(startTime, endTime).toMillis() / 1000.0, exitCode,
                usage.getInputTokens(), usage.getOutputTokens(),
                usage.getCacheCreationInputTokens(), usage.getCacheReadInputTokens());
            writer.main(trailer);
            writer.reasoning(trailer);

            log.info("Agent exited with code {}", exitCode);
            return toOutcome(parser, exitCode, model, logs);
        } catch (IOException e) {
            throw new AgentProcessException("Failed to start or log agent process: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killActiveProcess();
            throw new AgentProcessException("Interrupted while waiting for the agent process", e);
        }
    }

    /**
     * Stops the running agent, if any. Used when the orchestrator is shutting down.
     */
    public void killActiveProcess() {
        Process process = activeProcess.getAndSet(null);
        if (process != null && process.isAlive()) {
            log.warn("Killing active agent process {}", process.pid());
            process.destroyForcibly();
        }
    }

    List<String> buildCommand(String model) {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model);
        }
        return command;
    }

    private AgentOutcome toOutcome(AgentStreamParser parser, int exitCode, String model, StepLogs logs) {
        AgentOutcome.Kind kind;
        if (parser.getQuestion() != null) {
            kind = AgentOutcome.Kind.INTERVENTION_REQUESTED;
        } else if (parser.getRateLimitReset() != null) {
            kind = AgentOutcome.Kind.RATE_LIMITED;
        } else if (exitCode != 0) {
            kind = AgentOutcome.Kind.FAILURE;
        } else {
            kind = AgentOutcome.Kind.SUCCESS;
        }

        String modelUsed = parser.getModel() != null ? parser.getModel()
            : (model != null && !model.isBlank() ? model : "default");

        return AgentOutcome.builder()
            .kind(kind)
            .exitCode(exitCode)
            .output(parser.getOutput())
            .question(parser.getQuestion())
            .resetTime(parser.getRateLimitReset())
            .tokenUsage(parser.getTokenUsage())
            .modelUsed(modelUsed)
            .logFile(logs.getLogFile())
            .reasoningLogFile(logs.getReasoningLogFile())
            .build();
    }

    private Thread pumpStderr(Process process, StepLogWriter writer) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    writer.main(line + "\n");
                    writer.reasoning(String.format("[%s] [STDERR] %s%n", lineTimestamp(), line));
                }
            } catch (IOException e) {
                log.debug("Agent stderr closed: {}", e.getMessage());
            }
        }, "agent-stderr");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static String lineTimestamp() {
        return LocalDateTime.now(ZoneId.systemDefault()).format(LINE_TIMESTAMP);
    }

    /**
     * The three per-step log files, appended to by the stdout and stderr readers.
     */
    static final class StepLogWriter implements AutoCloseable {
        private final Writer main;
        private final Writer reasoning;
        private final Writer raw;

        private StepLogWriter(Writer main, Writer reasoning, Writer raw) {
            this.main = main;
            this.reasoning = reasoning;
            this.raw = raw;
        }

        static StepLogWriter open(StepLogs logs) throws IOException {
            Files.createDirectories(logs.getLogFile().toAbsolutePath().getParent());
            return new StepLogWriter(
                appender(logs.getLogFile()),
                appender(logs.getReasoningLogFile()),
                appender(logs.getRawJsonLogFile()));
        }

        private static Writer appender(Path file) throws IOException {
            return Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }

        synchronized void main(String text) {
            write(main, text);
        }

        synchronized void reasoning(String text) {
            write(reasoning, text);
        }

        synchronized void raw(String text) {
            write(raw, text);
        }

        private void write(Writer target, String text) {
            try {
                target.write(text);
                target.flush();
            } catch (IOException e) {
                throw new AgentProcessException("Could not write agent log: " + e.getMessage(), e);
            }
        }

        @Override
        public synchronized void close() throws IOException {
            try {
                main.close();
            } finally {
                try {
                    reasoning.close();
                } finally {
                    raw.close();
                }
            }
        }
    }
}
