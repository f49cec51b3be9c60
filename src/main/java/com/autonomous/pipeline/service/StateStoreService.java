package com.autonomous.pipeline.service;

import com.autonomous.pipeline.exception.PipelineException;
import com.autonomous.pipeline.model.JournalEvent;
import com.autonomous.pipeline.model.SequenceStatus;
import com.autonomous.pipeline.model.TaskStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reads and atomically rewrites task and sequence status files.
 *
 * <p>Every write goes to a hidden sibling temp file, is synced to disk and then renamed
 * over the target, so a concurrent reader sees either the previous or the new record.
 * This process is the only writer of a given status file, so no locking is done.
 */
@Slf4j
@Service
public class StateStoreService {

    private static final String STATE_SUFFIX = ".state.json";
    private static final String ANSWER_SUFFIX = ".answer";
    private static final String JOURNAL_FILE = "run-journal.json";

    private final ObjectMapper mapper;
    // Read-modify-write cycles from the run and the shutdown hook must not interleave
    private final Object updateLock = new Object();
    private Clock clock = Clock.systemUTC();

    public StateStoreService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public Path taskStatusFile(Path stateDir, String taskId) {
        return stateDir.resolve(taskId + STATE_SUFFIX);
    }

    public Path sequenceStatusFile(Path stateDir, String sequenceId) {
        return stateDir.resolve(sequenceId + STATE_SUFFIX);
    }

    /**
     * Returns the stored task record, or a fresh one if the file is missing or unreadable.
     */
    public TaskStatus readTask(Path file) {
        return read(file, TaskStatus.class, TaskStatus::new);
    }

    public TaskStatus updateTask(Path file, Consumer<TaskStatus> mutator) {
        synchronized (updateLock) {
            TaskStatus status = readTask(file);
            mutator.accept(status);
            status.setLastUpdate(now());
            writeAtomic(file, status);
            return status;
        }
    }

    public SequenceStatus readSequence(Path file) {
        return read(file, SequenceStatus.class, SequenceStatus::new);
    }

    public SequenceStatus updateSequence(Path file, Consumer<SequenceStatus> mutator) {
        synchronized (updateLock) {
            SequenceStatus status = readSequence(file);
            mutator.accept(status);
            status.setLastUpdate(now());
            writeAtomic(file, status);
            return status;
        }
    }

    // =================================================================
    // File-based answer channel
    // =================================================================

    public Path answerFile(Path stateDir, String taskId) {
        return stateDir.resolve(taskId + ANSWER_SUFFIX);
    }

    public void writeAnswer(Path stateDir, String taskId, String answer) {
        writeAtomic(answerFile(stateDir, taskId), answer.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Removes an answer left over from an earlier question so it cannot answer the next one.
     */
    public void discardAnswer(Path stateDir, String taskId) {
        Path file = answerFile(stateDir, taskId);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Discarded stale answer file {}", file);
            }
        } catch (IOException e) {
            throw new PipelineException("Could not remove stale answer file " + file, e);
        }
    }

    /**
     * Consumes an answer dropped by an external actor. The file is deleted once read.
     */
    public Optional<String> readAndDeleteAnswer(Path stateDir, String taskId) {
        Path file = answerFile(stateDir, taskId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String answer = Files.readString(file, StandardCharsets.UTF_8);
            Files.deleteIfExists(file);
            return Optional.of(answer.trim());
        } catch (IOException e) {
            throw new PipelineException("Could not consume answer file " + file, e);
        }
    }

    // =================================================================
    // Run journal
    // =================================================================

    public List<JournalEvent> readJournal(Path stateDir) {
        Path file = stateDir.resolve(JOURNAL_FILE);
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            return mapper.readValue(file.toFile(), new TypeReference<List<JournalEvent>>() {});
        } catch (IOException e) {
            log.warn("Could not read or parse {}. Starting a fresh journal: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Appends to the run journal. The journal is informational, so failures are only logged.
     */
    public void logJournalEvent(Path stateDir, JournalEvent event) {
        try {
            synchronized (updateLock) {
                List<JournalEvent> journal = readJournal(stateDir);
                event.setTimestamp(now());
                journal.add(event);
                writeAtomic(stateDir.resolve(JOURNAL_FILE), journal);
            }
        } catch (PipelineException e) {
            log.warn("Failed to log {} event for {}: {}", event.getEventType(), event.getId(), e.getMessage());
        }
    }

    private <T> T read(Path file, Class<T> type, Supplier<T> fallback) {
        if (!Files.exists(file)) {
            return fallback.get();
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : fallback.get();
        } catch (IOException e) {
            log.warn("State file {} is unreadable, treating it as absent: {}", file, e.getMessage());
            return fallback.get();
        }
    }

    void writeAtomic(Path file, Object value) {
        try {
            writeAtomic(file, mapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new PipelineException("Could not serialize state for " + file, e);
        }
    }

    private void writeAtomic(Path file, byte[] content) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + file.getFileName() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PipelineException("Could not write state file " + file, e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
