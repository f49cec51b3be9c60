package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One answered question in a task's interaction history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Interaction {
    private String question;
    private String answer;
    private Instant timestamp;
}
