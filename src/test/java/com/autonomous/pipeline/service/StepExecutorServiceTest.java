package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.AgentProcessException;
import com.autonomous.pipeline.exception.CheckFailedException;
import com.autonomous.pipeline.exception.GitStateException;
import com.autonomous.pipeline.exception.RateLimitReachedException;
import com.autonomous.pipeline.model.AgentOutcome;
import com.autonomous.pipeline.model.CheckConfig;
import com.autonomous.pipeline.model.CheckResult;
import com.autonomous.pipeline.model.PendingQuestion;
import com.autonomous.pipeline.model.Phase;
import com.autonomous.pipeline.model.PipelineStep;
import com.autonomous.pipeline.model.ProjectConfig;
import com.autonomous.pipeline.model.StepLogs;
import com.autonomous.pipeline.model.StepPhase;
import com.autonomous.pipeline.model.TaskStatus;
import com.autonomous.pipeline.model.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StepExecutorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String PROMPT = "Implement the feature.";

    @Mock
    private ClaudeAgentService agentService;

    @Mock
    private CheckRunnerService checkRunner;

    @Mock
    private GitService gitService;

    @Mock
    private HumanInputService humanInput;

    @Mock
    private InterruptionHandler interruptionHandler;

    @TempDir
    Path projectRoot;

    private StateStoreService stateStore;
    private StepExecutorService executor;
    private ProjectConfig config;
    private Path statusFile;
    private StepLogs logs;
    private final List<Long> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        stateStore = new StateStoreService();
        stateStore.setClock(Clock.fixed(NOW, ZoneOffset.UTC));
        executor = new StepExecutorService(stateStore, agentService, checkRunner, gitService, humanInput,
            interruptionHandler);
        executor.setSleeper(sleeps::add);

        config = new ProjectConfig();
        config.setProjectRoot(projectRoot);
        statusFile = stateStore.taskStatusFile(config.resolveStateDir(), "task-demo");
        logs = StepLogs.forStep(config.resolveLogsDir().resolve("task-demo"), 1, "implement");
        stateStore.updateTask(statusFile, s -> {
            s.setTaskId("task-demo");
            s.getSteps().put("implement", StepPhase.PENDING);
        });
    }

    @Test
    void shouldRetryFailingCheckUpToBoundThenFail() {
        PipelineStep step = step(2);
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.failed("3 tests failed"));

        CheckFailedException e = assertThrows(CheckFailedException.class,
            () -> executor.execute(config, step, PROMPT, statusFile, logs, null));

        verify(agentService, times(3)).invoke(anyString(), any(), any(), any());
        assertEquals("3 tests failed", e.getCheckOutput());
        assertTrue(e.getMessage().contains("failed after 2 retries"));
        TaskStatus status = stateStore.readTask(statusFile);
        assertEquals(Phase.FAILED, status.getPhase());
        assertEquals(StepPhase.FAILED, status.getSteps().get("implement"));
        verifyNoInteractions(gitService);
    }

    @Test
    void shouldFeedCheckOutputIntoNextAttempt() {
        PipelineStep step = step(1);
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any()))
            .thenReturn(CheckResult.failed("expected 200 but got 500"))
            .thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step, PROMPT, statusFile, logs, null);

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(agentService, times(2)).invoke(prompts.capture(), any(), any(), any());
        assertEquals(PROMPT, prompts.getAllValues().get(0));
        String retryPrompt = prompts.getAllValues().get(1);
        assertTrue(retryPrompt.startsWith(PROMPT));
        assertTrue(retryPrompt.contains("--- ERROR OUTPUT ---\nexpected 200 but got 500"));
        assertTrue(retryPrompt.contains("failed its validation check"));
    }

    @Test
    void shouldNotSpendRetryOnQuestion() {
        PipelineStep step = step(0);
        when(agentService.invoke(anyString(), any(), any(), any()))
            .thenReturn(question("Which database should I use?", 10, 5))
            .thenReturn(success(7, 3));
        when(humanInput.awaitAnswer(eq(statusFile), eq("task-demo"), eq("Which database should I use?"), isNull()))
            .thenAnswer(invocation -> {
                TaskStatus parked = stateStore.readTask(statusFile);
                assertEquals(Phase.WAITING_FOR_INPUT, parked.getPhase());
                assertEquals("Which database should I use?", parked.getPendingQuestion().getQuestion());
                return "PostgreSQL";
            });
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step, PROMPT, statusFile, logs, null);

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(agentService, times(2)).invoke(prompts.capture(), any(), any(), any());
        assertTrue(prompts.getAllValues().get(1).contains(
            "You previously asked: \"Which database should I use?\". The user responded: \"PostgreSQL\"."));
        verify(checkRunner, times(1)).run(anyList(), any());

        TaskStatus status = stateStore.readTask(statusFile);
        assertEquals(StepPhase.DONE, status.getSteps().get("implement"));
        assertEquals("abc123", status.getLastCommit());
        TokenUsage usage = status.getTokenUsage().get("sonnet");
        assertEquals(17, usage.getInputTokens());
        assertEquals(8, usage.getOutputTokens());
    }

    @Test
    void shouldAnswerPendingQuestionBeforeInvokingAgent() throws Exception {
        stateStore.updateTask(statusFile, s -> {
            s.setPhase(Phase.WAITING_FOR_INPUT);
            s.setPendingQuestion(new PendingQuestion("Keep the old API?", NOW));
        });
        when(humanInput.awaitAnswer(statusFile, "task-demo", "Keep the old API?", null)).thenReturn("No");
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step(0), PROMPT, statusFile, logs, null);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(agentService, times(1)).invoke(prompt.capture(), any(), any(), any());
        assertTrue(prompt.getValue().contains("The user responded: \"No\""));
        assertTrue(Files.readString(logs.getReasoningLogFile()).contains("[USER_INPUT] User answered: \"No\""));
    }

    @Test
    void shouldFailStepWhenAgentFails() {
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(AgentOutcome.builder()
            .kind(AgentOutcome.Kind.FAILURE)
            .exitCode(1)
            .modelUsed("sonnet")
            .logFile(logs.getLogFile())
            .reasoningLogFile(logs.getReasoningLogFile())
            .build());

        AgentProcessException e = assertThrows(AgentProcessException.class,
            () -> executor.execute(config, step(3), PROMPT, statusFile, logs, null));

        assertEquals(logs.getLogFile(), e.getLogFile());
        assertTrue(e.getMessage().contains(logs.getReasoningLogFile().toString()));
        verifyNoInteractions(checkRunner);
        assertEquals(StepPhase.FAILED, stateStore.readTask(statusFile).getSteps().get("implement"));
    }

    @Test
    void shouldFailStepAndTaskWhenCheckpointCommitFails() {
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement"))
            .thenThrow(new GitStateException("Failed to commit checkpoint for step implement"));

        assertThrows(GitStateException.class,
            () -> executor.execute(config, step(0), PROMPT, statusFile, logs, null));

        TaskStatus status = stateStore.readTask(statusFile);
        assertEquals(Phase.FAILED, status.getPhase());
        assertEquals(StepPhase.FAILED, status.getSteps().get("implement"));
        assertNull(status.getLastCommit());
    }

    @Test
    void shouldFailStepWhenAgentCannotBeStarted() {
        when(agentService.invoke(anyString(), any(), any(), any()))
            .thenThrow(new AgentProcessException("Could not start the agent process",
                new IOException("No such file or directory")));

        assertThrows(AgentProcessException.class,
            () -> executor.execute(config, step(2), PROMPT, statusFile, logs, null));

        TaskStatus status = stateStore.readTask(statusFile);
        assertEquals(Phase.FAILED, status.getPhase());
        assertEquals(StepPhase.FAILED, status.getSteps().get("implement"));
        verifyNoInteractions(checkRunner);
    }

    @Test
    void shouldDiscardStaleAnswerFileBeforeAskingNewQuestion() {
        Path answerFile = stateStore.answerFile(config.resolveStateDir(), "task-demo");
        stateStore.writeAnswer(config.resolveStateDir(), "task-demo", "answer to an older question");
        when(agentService.invoke(anyString(), any(), any(), any()))
            .thenReturn(question("Rename the module?", 1, 1))
            .thenReturn(success(1, 1));
        when(humanInput.awaitAnswer(statusFile, "task-demo", "Rename the module?", null))
            .thenAnswer(invocation -> {
                assertFalse(Files.exists(answerFile));
                return "Yes";
            });
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step(0), PROMPT, statusFile, logs, null);

        verify(humanInput).awaitAnswer(statusFile, "task-demo", "Rename the module?", null);
    }

    @Test
    void shouldKeepAnswerFileForParkedQuestion() {
        Path answerFile = stateStore.answerFile(config.resolveStateDir(), "task-demo");
        stateStore.updateTask(statusFile, s -> {
            s.setPhase(Phase.WAITING_FOR_INPUT);
            s.setPendingQuestion(new PendingQuestion("Keep the old API?", NOW));
        });
        stateStore.writeAnswer(config.resolveStateDir(), "task-demo", "No");
        when(humanInput.awaitAnswer(statusFile, "task-demo", "Keep the old API?", null))
            .thenAnswer(invocation -> {
                assertTrue(Files.exists(answerFile));
                return "No";
            });
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step(0), PROMPT, statusFile, logs, null);

        verify(humanInput).awaitAnswer(statusFile, "task-demo", "Keep the old API?", null);
    }

    @Test
    void shouldFailOnRateLimitWhenWaitingDisabled() {
        Instant reset = NOW.plusSeconds(3600);
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(rateLimited(reset));

        RateLimitReachedException e = assertThrows(RateLimitReachedException.class,
            () -> executor.execute(config, step(0), PROMPT, statusFile, logs, null));

        assertEquals(reset, e.getResetTime());
        assertEquals(Phase.FAILED, stateStore.readTask(statusFile).getPhase());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldWaitForResetAndResumeWithoutSpendingAttempt() {
        config.setWaitForRateLimitReset(true);
        Path sequenceFile = stateStore.sequenceStatusFile(config.resolveStateDir(), "sequence-demo");
        stateStore.updateSequence(sequenceFile, s -> s.setSequenceId("sequence-demo"));
        when(agentService.invoke(anyString(), any(), any(), any()))
            .thenReturn(rateLimited(NOW.plusSeconds(600)))
            .thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step(0), PROMPT, statusFile, logs, sequenceFile);

        assertEquals(List.of(600_000L), sleeps);
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(agentService, times(2)).invoke(prompts.capture(), any(), any(), any());
        assertTrue(prompts.getAllValues().get(1).contains("interrupted by an API usage limit"));

        TaskStatus status = stateStore.readTask(statusFile);
        assertEquals(Phase.RUNNING, status.getPhase());
        assertEquals(600.0, status.getStats().getTotalPauseTime(), 0.001);
        assertEquals(600.0, stateStore.readSequence(sequenceFile).getStats().getTotalPauseTime(), 0.001);
    }

    @Test
    void shouldReinvokeImmediatelyWhenResetAlreadyPassed() {
        config.setWaitForRateLimitReset(true);
        when(agentService.invoke(anyString(), any(), any(), any()))
            .thenReturn(rateLimited(NOW.minusSeconds(5)))
            .thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());
        when(gitService.commitCheckpoint(projectRoot, "implement")).thenReturn("abc123");

        executor.execute(config, step(0), PROMPT, statusFile, logs, null);

        assertTrue(sleeps.isEmpty());
        verify(agentService, times(2)).invoke(anyString(), any(), any(), any());
    }

    @Test
    void shouldSkipCommitWhenAutoCommitDisabled() {
        config.setAutoCommit(false);
        when(agentService.invoke(anyString(), any(), any(), any())).thenReturn(success(1, 1));
        when(checkRunner.run(anyList(), any())).thenReturn(CheckResult.passed());

        executor.execute(config, step(0), PROMPT, statusFile, logs, null);

        verifyNoInteractions(gitService);
        assertEquals(StepPhase.DONE, stateStore.readTask(statusFile).getSteps().get("implement"));
    }

    private static PipelineStep step(int retry) {
        return PipelineStep.builder()
            .name("implement")
            .command("implement")
            .check(List.of(CheckConfig.shell("run-tests", CheckConfig.Expect.PASS)))
            .retry(retry)
            .build();
    }

    private static AgentOutcome success(long input, long output) {
        return AgentOutcome.builder()
            .kind(AgentOutcome.Kind.SUCCESS)
            .modelUsed("sonnet")
            .tokenUsage(TokenUsage.builder().inputTokens(input).outputTokens(output).build())
            .build();
    }

    private static AgentOutcome question(String question, long input, long output) {
        return AgentOutcome.builder()
            .kind(AgentOutcome.Kind.INTERVENTION_REQUESTED)
            .question(question)
            .exitCode(143)
            .modelUsed("sonnet")
            .tokenUsage(TokenUsage.builder().inputTokens(input).outputTokens(output).build())
            .build();
    }

    private static AgentOutcome rateLimited(Instant reset) {
        return AgentOutcome.builder()
            .kind(AgentOutcome.Kind.RATE_LIMITED)
            .resetTime(reset)
            .modelUsed("sonnet")
            .build();
    }
}
