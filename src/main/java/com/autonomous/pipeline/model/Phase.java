package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle phase of a task or sequence. Serialized in snake_case so external
 * readers of the state files see stable strings.
 */
public enum Phase {
    @JsonProperty("pending") PENDING,
    @JsonProperty("running") RUNNING,
    @JsonProperty("waiting_for_input") WAITING_FOR_INPUT,
    @JsonProperty("done") DONE,
    @JsonProperty("failed") FAILED,
    @JsonProperty("interrupted") INTERRUPTED,
    @JsonProperty("waiting_for_reset") WAITING_FOR_RESET;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
