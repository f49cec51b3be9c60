package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InterruptionHandlerTest {

    @Mock
    private ClaudeAgentService agentService;

    @TempDir
    Path stateDir;

    private StateStoreService stateStore;
    private InterruptionHandler handler;

    @BeforeEach
    void setUp() {
        stateStore = new StateStoreService();
        handler = new InterruptionHandler(stateStore, agentService);
    }

    @Test
    void shouldMarkRunningTaskAndSequenceInterrupted() {
        Path task = stateStore.taskStatusFile(stateDir, "task-a");
        Path sequence = stateStore.sequenceStatusFile(stateDir, "sequence-s");
        stateStore.updateTask(task, s -> s.setPhase(Phase.RUNNING));
        stateStore.updateSequence(sequence, s -> s.setPhase(Phase.RUNNING));
        handler.trackTask(task);
        handler.trackSequence(sequence);

        handler.onShutdown();

        assertTrue(handler.isInterrupted());
        verify(agentService).killActiveProcess();
        assertEquals(Phase.INTERRUPTED, stateStore.readTask(task).getPhase());
        assertEquals(Phase.INTERRUPTED, stateStore.readSequence(sequence).getPhase());
    }

    @Test
    void shouldKeepWaitingAndFinishedPhases() {
        Path waiting = stateStore.taskStatusFile(stateDir, "task-waiting");
        Path finished = stateStore.sequenceStatusFile(stateDir, "sequence-done");
        stateStore.updateTask(waiting, s -> s.setPhase(Phase.WAITING_FOR_INPUT));
        stateStore.updateSequence(finished, s -> s.setPhase(Phase.DONE));
        handler.trackTask(waiting);
        handler.trackSequence(finished);

        handler.onShutdown();

        assertEquals(Phase.WAITING_FOR_INPUT, stateStore.readTask(waiting).getPhase());
        assertEquals(Phase.DONE, stateStore.readSequence(finished).getPhase());
    }

    @Test
    void shouldDoNothingWhenNothingIsTracked() {
        Path task = stateStore.taskStatusFile(stateDir, "task-a");
        stateStore.updateTask(task, s -> s.setPhase(Phase.RUNNING));
        handler.trackTask(task);
        handler.untrackTask();

        handler.onShutdown();

        verifyNoInteractions(agentService);
        assertEquals(Phase.RUNNING, stateStore.readTask(task).getPhase());
    }
}
