package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SequenceStatus {
    private int version = 1;
    private String sequenceId;
    private String branch;
    private Phase phase = Phase.PENDING;
    private String currentTaskPath;
    private List<String> completedTasks = new ArrayList<>();
    private RunStats stats;
    private Instant startTime;
    private Instant lastUpdate;

    @JsonIgnore
    public boolean isNew() {
        return sequenceId == null;
    }

    @JsonIgnore
    public RunStats getOrCreateStats() {
        if (stats == null) {
            stats = RunStats.forSequence();
        }
        if (stats.getTotalTokenUsage() == null) {
            stats.setTotalTokenUsage(new LinkedHashMap<>());
        }
        return stats;
    }
}
