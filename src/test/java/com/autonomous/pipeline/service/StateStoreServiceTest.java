package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.Interaction;
import com.autonomous.pipeline.model.JournalEvent;
import com.autonomous.pipeline.model.Phase;
import com.autonomous.pipeline.model.StepPhase;
import com.autonomous.pipeline.model.TaskStatus;
import com.autonomous.pipeline.model.TokenUsage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private StateStoreService stateStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        stateStore = new StateStoreService();
        stateStore.setClock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnFreshRecordWhenFileIsMissing() {
        TaskStatus status = stateStore.readTask(tempDir.resolve("missing.state.json"));

        assertTrue(status.isNew());
        assertEquals(Phase.PENDING, status.getPhase());
        assertTrue(status.getSteps().isEmpty());
    }

    @Test
    void shouldTreatCorruptFileAsAbsent() throws Exception {
        Path file = tempDir.resolve("task-x.state.json");
        Files.writeString(file, "{ \"taskId\": \"task-x\", \"phase\": ");

        TaskStatus status = stateStore.readTask(file);

        assertTrue(status.isNew());
    }

    @Test
    void shouldStampLastUpdateAndPersist() {
        Path file = stateStore.taskStatusFile(tempDir, "task-demo");

        stateStore.updateTask(file, s -> {
            s.setTaskId("task-demo");
            s.setPhase(Phase.RUNNING);
            s.getSteps().put("plan", StepPhase.DONE);
            s.getSteps().put("implement", StepPhase.PENDING);
            TokenUsage.merge(s.getTokenUsage(), "sonnet", TokenUsage.builder().inputTokens(10).outputTokens(5).build());
        });

        TaskStatus reloaded = stateStore.readTask(file);
        assertEquals("task-demo", reloaded.getTaskId());
        assertEquals(Phase.RUNNING, reloaded.getPhase());
        assertEquals(NOW, reloaded.getLastUpdate());
        assertEquals(List.of("plan", "implement"), List.copyOf(reloaded.getSteps().keySet()));
        assertEquals(10, reloaded.getTokenUsage().get("sonnet").getInputTokens());
    }

    @Test
    void shouldWriteSnakeCasePhasesForExternalReaders() throws Exception {
        Path file = stateStore.taskStatusFile(tempDir, "task-demo");
        stateStore.updateTask(file, s -> {
            s.setTaskId("task-demo");
            s.setPhase(Phase.WAITING_FOR_INPUT);
        });

        JsonNode json = new ObjectMapper().readTree(file.toFile());

        assertEquals("waiting_for_input", json.get("phase").asText());
        assertEquals("2026-03-01T10:15:30Z", json.get("lastUpdate").asText());
        assertFalse(json.has("pendingQuestion"));
    }

    @Test
    void shouldNotLeaveTempFilesBehind() throws Exception {
        Path file = stateStore.taskStatusFile(tempDir, "task-demo");
        stateStore.updateTask(file, s -> s.setTaskId("task-demo"));
        stateStore.updateTask(file, s -> s.setPhase(Phase.DONE));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file.getFileName().toString()),
                files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void shouldNeverExposePartialRecordToConcurrentReader() throws Exception {
        Path file = stateStore.taskStatusFile(tempDir, "task-demo");
        stateStore.updateTask(file, s -> s.setTaskId("task-demo"));

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger badReads = new AtomicInteger();
        Thread reader = new Thread(() -> {
            ObjectMapper mapper = new ObjectMapper();
            while (!done.get()) {
                try {
                    JsonNode json = mapper.readTree(Files.readString(file));
                    if (json == null || !"task-demo".equals(json.path("taskId").asText())) {
                        badReads.incrementAndGet();
                    }
                } catch (Exception e) {
                    badReads.incrementAndGet();
                }
            }
        });
        reader.start();

        for (int i = 0; i < 200; i++) {
            int n = i;
            stateStore.updateTask(file, s -> s.getInteractionHistory()
                .add(new Interaction("question " + n, "answer " + n, NOW)));
        }
        done.set(true);
        reader.join();

        assertEquals(0, badReads.get());
        assertEquals(200, stateStore.readTask(file).getInteractionHistory().size());
    }

    @Test
    void shouldNotLoseUpdatesFromConcurrentWriters() throws Exception {
        Path file = stateStore.taskStatusFile(tempDir, "task-demo");
        stateStore.updateTask(file, s -> s.setTaskId("task-demo"));

        AtomicInteger failures = new AtomicInteger();
        Runnable writer = () -> {
            for (int i = 0; i < 100; i++) {
                try {
                    stateStore.updateTask(file, s -> TokenUsage.merge(s.getTokenUsage(), "opus",
                        TokenUsage.builder().inputTokens(1).build()));
                } catch (RuntimeException e) {
                    failures.incrementAndGet();
                }
            }
        };
        Thread first = new Thread(writer);
        Thread second = new Thread(writer);
        first.start();
        second.start();
        first.join();
        second.join();

        assertEquals(0, failures.get());
        assertEquals(200, stateStore.readTask(file).getTokenUsage().get("opus").getInputTokens());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void shouldConsumeAnswerFileOnce() {
        stateStore.writeAnswer(tempDir, "task-demo", "  use PostgreSQL \n");

        Optional<String> first = stateStore.readAndDeleteAnswer(tempDir, "task-demo");
        Optional<String> second = stateStore.readAndDeleteAnswer(tempDir, "task-demo");

        assertEquals(Optional.of("use PostgreSQL"), first);
        assertTrue(second.isEmpty());
        assertFalse(Files.exists(stateStore.answerFile(tempDir, "task-demo")));
    }

    @Test
    void shouldAppendJournalEvents() {
        stateStore.logJournalEvent(tempDir, JournalEvent.builder()
            .eventType(JournalEvent.Type.TASK_STARTED).id("task-demo").build());
        stateStore.logJournalEvent(tempDir, JournalEvent.builder()
            .eventType(JournalEvent.Type.TASK_FINISHED).id("task-demo").status(Phase.DONE).build());

        List<JournalEvent> journal = stateStore.readJournal(tempDir);

        assertEquals(2, journal.size());
        assertEquals(JournalEvent.Type.TASK_STARTED, journal.get(0).getEventType());
        assertEquals(Phase.DONE, journal.get(1).getStatus());
        assertEquals(NOW, journal.get(1).getTimestamp());
    }
}
