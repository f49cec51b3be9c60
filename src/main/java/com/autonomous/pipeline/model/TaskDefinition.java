package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A task markdown file split into its front matter settings and body.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskDefinition {
    private String pipeline;
    private Integer autonomyLevel;
    private String body;
}
