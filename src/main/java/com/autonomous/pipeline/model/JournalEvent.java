package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry of the run journal, an append-only history of task and sequence runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JournalEvent {

    public enum Type {
        @JsonProperty("task_started") TASK_STARTED,
        @JsonProperty("task_finished") TASK_FINISHED,
        @JsonProperty("sequence_started") SEQUENCE_STARTED,
        @JsonProperty("sequence_finished") SEQUENCE_FINISHED
    }

    private Instant timestamp;
    private Type eventType;
    private String id;
    private String parentId;
    private Phase status;
}
