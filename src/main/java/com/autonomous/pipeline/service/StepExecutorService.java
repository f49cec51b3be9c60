package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.AgentProcessException;
import com.autonomous.pipeline.exception.CheckFailedException;
import com.autonomous.pipeline.exception.InterruptedWhileWaitingException;
import com.autonomous.pipeline.exception.RateLimitReachedException;
import com.autonomous.pipeline.exception.TaskInterruptedException;
import com.autonomous.pipeline.logging.MdcContext;
import com.autonomous.pipeline.model.AgentOutcome;
import com.autonomous.pipeline.model.CheckResult;
import com.autonomous.pipeline.model.PendingQuestion;
import com.autonomous.pipeline.model.Phase;
import com.autonomous.pipeline.model.PipelineStep;
import com.autonomous.pipeline.model.ProjectConfig;
import com.autonomous.pipeline.model.StepLogs;
import com.autonomous.pipeline.model.StepPhase;
import com.autonomous.pipeline.model.TaskStatus;
import com.autonomous.pipeline.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
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

/**
 * Runs one pipeline step to completion.
 *
 * <p>Each attempt invokes the agent and then runs the step's checks. A question from the agent
 * is answered and the agent re-invoked without using up an attempt; so is a usage-limit wait.
 * Only failing checks consume retries. Feedback from earlier attempts accumulates in the prompt.
 */
@Slf4j
@Service
public class StepExecutorService {

    static final long LONG_WAIT_WARNING_MILLIS = Duration.ofHours(8).toMillis();

    static final String RATE_LIMIT_RESUME_FEEDBACK = "You are resuming an automated task that was interrupted by an "
        + "API usage limit. Your progress up to the point of interruption has been saved. Your goal is to review "
        + "your previous actions and continue the task from where you left off.";

    private static final DateTimeFormatter LINE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Blocks the step until a usage-limit reset. Replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final StateStoreService stateStore;
    private final ClaudeAgentService agentService;
    private final CheckRunnerService checkRunner;
    private final GitService gitService;
    private final HumanInputService humanInput;
    private final InterruptionHandler interruptionHandler;

    private Sleeper sleeper = Thread::sleep;

    public StepExecutorService(StateStoreService stateStore,
                               ClaudeAgentService agentService,
                               CheckRunnerService checkRunner,
                               GitService gitService,
                               HumanInputService humanInput,
                               InterruptionHandler interruptionHandler) {
        this.stateStore = stateStore;
        this.agentService = agentService;
        this.checkRunner = checkRunner;
        this.gitService = gitService;
        this.humanInput = humanInput;
        this.interruptionHandler = interruptionHandler;
    }

    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Executes {@code step} with the assembled {@code prompt}. Returns once the step is
     * {@code done}; every other ending is thrown.
     *
     * @param sequenceStatusFile status of the enclosing sequence, or {@code null} for a standalone task
     * @throws AgentProcessException if the agent exits unsuccessfully without asking a question
     * @throws CheckFailedException if the checks still fail after the last retry
     * @throws RateLimitReachedException if the usage limit is hit and waiting is disabled
     * @throws com.autonomous.pipeline.exception.GitStateException if the checkpoint commit fails
     */
    public void execute(ProjectConfig config, PipelineStep step, String prompt, Path statusFile,
                        StepLogs logs, Path sequenceStatusFile) {
        String name = step.getName();
        MdcContext.setStep(name);
        try {
            log.info("Starting step: {}", name);
            TaskStatus status = stateStore.updateTask(statusFile, s -> {
                s.setCurrentStep(name);
                s.getSteps().put(name, StepPhase.RUNNING);
                if (s.getPhase() != Phase.WAITING_FOR_INPUT) {
                    s.setPhase(Phase.RUNNING);
                }
            });
            String taskId = status.getTaskId();
            List<String> feedback = new ArrayList<>();

            if (status.getPhase() == Phase.WAITING_FOR_INPUT && status.getPendingQuestion() != null) {
                String question = status.getPendingQuestion().getQuestion();
                log.info("Step \"{}\" is waiting on a question from a previous run", name);
                String answer = humanInput.awaitAnswer(statusFile, taskId, question, sequenceStatusFile);
                recordAnswer(logs, answer);
                feedback.add(answerFeedback(question, answer));
            }

            int maxRetries = step.maxRetries();
            int attempt = 1;
            while (true) {
                AgentOutcome outcome = agentService.invoke(withFeedback(prompt, feedback),
                    config.getProjectRoot(), step.getModel(), logs);
                recordTokenUsage(statusFile, outcome);
                if (interruptionHandler.isInterrupted()) {
                    throw new TaskInterruptedException("Process was interrupted by the user.");
                }

                if (outcome.getKind() == AgentOutcome.Kind.INTERVENTION_REQUESTED) {
                    String question = outcome.getQuestion();
                    String answer = askHuman(statusFile, taskId, question, sequenceStatusFile);
                    recordAnswer(logs, answer);
                    feedback.add(answerFeedback(question, answer));
                    continue;
                }

                if (outcome.getKind() == AgentOutcome.Kind.RATE_LIMITED) {
                    if (!config.isWaitForRateLimitReset()) {
                        markFailed(statusFile, name);
                        throw new RateLimitReachedException(outcome.getResetTime());
                    }
                    waitForReset(outcome.getResetTime(), name, statusFile, sequenceStatusFile);
                    feedback.add(RATE_LIMIT_RESUME_FEEDBACK);
                    continue;
                }

                if (outcome.getKind() == AgentOutcome.Kind.FAILURE) {
                    markFailed(statusFile, name);
                    throw new AgentProcessException(
                        String.format("Step \"%s\" failed (exit code %d).", name, outcome.getExitCode()),
                        outcome.getLogFile(), outcome.getReasoningLogFile());
                }

                CheckResult check = checkRunner.run(step.getCheck(), config.getProjectRoot());
                if (check.isSuccess()) {
                    complete(config, name, statusFile);
                    return;
                }

                log.warn("Check failed for step \"{}\" (attempt {}/{})", name, attempt, maxRetries + 1);
                if (attempt > maxRetries) {
                    markFailed(statusFile, name);
                    throw new CheckFailedException(name, maxRetries, check.getOutput());
                }
                feedback.add(checkFeedback(step, check.getOutput()));
                attempt++;
                log.info("Retry attempt {}/{} for step: {}", attempt - 1, maxRetries, name);
            }
        } catch (InterruptedWhileWaitingException | TaskInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            // Any other ending leaves the step failed, never running
            markFailed(statusFile, name);
            throw e;
        } finally {
            MdcContext.clearStep();
        }
    }

    private String askHuman(Path statusFile, String taskId, String question, Path sequenceStatusFile) {
        stateStore.discardAnswer(statusFile.toAbsolutePath().getParent(), taskId);
        stateStore.updateTask(statusFile, s -> {
            s.setPhase(Phase.WAITING_FOR_INPUT);
            s.setPendingQuestion(new PendingQuestion(question, stateStore.now()));
        });
        if (sequenceStatusFile != null) {
            stateStore.updateSequence(sequenceStatusFile, s -> s.setPhase(Phase.WAITING_FOR_INPUT));
        }
        return humanInput.awaitAnswer(statusFile, taskId, question, sequenceStatusFile);
    }

    private void waitForReset(Instant resetTime, String name, Path statusFile, Path sequenceStatusFile) {
        long waitMillis = Duration.between(stateStore.now(), resetTime).toMillis();
        if (waitMillis <= 0) {
            log.info("Usage limit reset time {} has already passed. Resuming step: {}", resetTime, name);
            return;
        }
        log.warn("Agent usage limit reached. Pausing until {}", resetTime);
        if (waitMillis > LONG_WAIT_WARNING_MILLIS) {
            log.warn("The usage limit resets at {}; the process will pause for over 8 hours. "
                + "You can stop it now and re-run after the reset time.", resetTime);
        }

        double pauseSeconds = waitMillis / 1000.0;
        stateStore.updateTask(statusFile, s -> {
            s.setPhase(Phase.WAITING_FOR_RESET);
            s.getOrCreateStats().addPause(pauseSeconds);
        });
        if (sequenceStatusFile != null) {
            stateStore.updateSequence(sequenceStatusFile, s -> {
                s.setPhase(Phase.WAITING_FOR_RESET);
                s.getOrCreateStats().addPause(pauseSeconds);
            });
        }

        try {
            sleeper.sleep(waitMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskInterruptedException("Interrupted while waiting for the usage limit to reset");
        }

        log.info("Resuming step: {}", name);
        stateStore.updateTask(statusFile, s -> s.setPhase(Phase.RUNNING));
        if (sequenceStatusFile != null) {
            stateStore.updateSequence(sequenceStatusFile, s -> s.setPhase(Phase.RUNNING));
        }
    }

    private void complete(ProjectConfig config, String name, Path statusFile) {
        String commit = null;
        if (config.isAutoCommit()) {
            commit = gitService.commitCheckpoint(config.getProjectRoot(), name);
        } else {
            log.info("Step \"{}\" successful. Auto-commit is disabled.", name);
        }
        String lastCommit = commit;
        stateStore.updateTask(statusFile, s -> {
            s.getSteps().put(name, StepPhase.DONE);
            if (lastCommit != null) {
                s.setLastCommit(lastCommit);
            }
        });
        log.info("Step \"{}\" done", name);
    }

    private void markFailed(Path statusFile, String name) {
        stateStore.updateTask(statusFile, s -> {
            s.setPhase(Phase.FAILED);
            s.getSteps().put(name, StepPhase.FAILED);
        });
    }

    private void recordTokenUsage(Path statusFile, AgentOutcome outcome) {
        TokenUsage usage = outcome.getTokenUsage();
        if (usage == null || usage.isEmpty()) {
            return;
        }
        stateStore.updateTask(statusFile, s -> TokenUsage.merge(s.getTokenUsage(), outcome.getModelUsed(), usage));
    }

    private void recordAnswer(StepLogs logs, String answer) {
        String line = String.format("[%s] [USER_INPUT] User answered: \"%s\"%n%n",
            LocalDateTime.now(ZoneId.systemDefault()).format(LINE_TIMESTAMP), answer);
        try {
            Files.createDirectories(logs.getReasoningLogFile().toAbsolutePath().getParent());
            Files.writeString(logs.getReasoningLogFile(), line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not record answer in {}: {}", logs.getReasoningLogFile(), e.getMessage());
        }
    }

    static String withFeedback(String prompt, List<String> feedback) {
        if (feedback.isEmpty()) {
            return prompt;
        }
        StringBuilder builder = new StringBuilder(prompt);
        for (String fragment : feedback) {
            builder.append("\n\n--- FEEDBACK ---\n").append(fragment).append("\n--- END FEEDBACK ---");
        }
        builder.append("\n\nPlease analyze the provided information and continue executing the plan to complete the step.");
        return builder.toString();
    }

    static String answerFeedback(String question, String answer) {
        return String.format("You previously asked: \"%s\". The user responded: \"%s\". "
            + "Continue your work based on this answer.", question, answer);
    }

    static String checkFeedback(PipelineStep step, String checkOutput) {
        String checkDescription = step.hasMultipleChecks() ? "One of the validation checks" : "The validation check";
        return String.format("Your previous attempt to complete the '%s' step failed its validation check.%n%n"
                + "%s failed with the following error output:%n"
                + "--- ERROR OUTPUT ---%n%s%n--- END ERROR OUTPUT ---%n%n"
                + "Please re-attempt the task. Your goal is to satisfy the original instructions above while also "
                + "fixing the error reported here. Analyze both the original goal and the specific failure. "
                + "Do not modify the tests or checks.",
            step.getName(), checkDescription,
            checkOutput == null || checkOutput.isBlank() ? "No output captured" : checkOutput);
    }
}
