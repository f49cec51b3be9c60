package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent status record of one task. This is the schema external readers
 * (dashboards, the file-access guard hook) rely on, so fields are only ever added.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskStatus {
    public static final int SCHEMA_VERSION = 2;

    private int version = SCHEMA_VERSION;
    private String taskId;
    private String taskPath;
    private String branch;
    private String pipeline;
    private String parentSequenceId;
    private Phase phase = Phase.PENDING;
    private Map<String, StepPhase> steps = new LinkedHashMap<>();
    private String currentStep;
    private PendingQuestion pendingQuestion;
    private List<Interaction> interactionHistory = new ArrayList<>();
    private Map<String, TokenUsage> tokenUsage = new LinkedHashMap<>();
    private RunStats stats;
    private String lastCommit;
    private Instant startTime;
    private Instant lastUpdate;

    @JsonIgnore
    public boolean isNew() {
        return taskId == null;
    }

    @JsonIgnore
    public boolean isStepDone(String stepName) {
        return steps.get(stepName) == StepPhase.DONE;
    }

    @JsonIgnore
    public RunStats getOrCreateStats() {
        if (stats == null) {
            stats = new RunStats();
        }
        return stats;
    }
}
