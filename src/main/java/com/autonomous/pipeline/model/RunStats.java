package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durations are in seconds. {@code totalTokenUsage} is only filled for sequences.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunStats {
    private double totalDuration;
    private double totalDurationExcludingPauses;
    private double totalPauseTime;
    private Map<String, TokenUsage> totalTokenUsage;

    public static RunStats forSequence() {
        RunStats stats = new RunStats();
        stats.setTotalTokenUsage(new LinkedHashMap<>());
        return stats;
    }

    public void addPause(double seconds) {
        totalPauseTime += seconds;
    }

    public void finish(double totalSeconds) {
        totalDuration = totalSeconds;
        totalDurationExcludingPauses = Math.max(0, totalSeconds - totalPauseTime);
    }
}
