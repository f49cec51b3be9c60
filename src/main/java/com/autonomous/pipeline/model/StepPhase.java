package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Phase of a single pipeline step. Moves only pending -> running -> done | failed.
 */
public enum StepPhase {
    @JsonProperty("pending") PENDING,
    @JsonProperty("running") RUNNING,
    @JsonProperty("done") DONE,
    @JsonProperty("failed") FAILED
}
