package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class ProjectConfig {
    private String taskFolder = "pipeline-tasks";
    private String statePath = ".pipeline-agent/state";
    private String logsPath = ".pipeline-agent/logs";

    // Git settings
    private boolean manageGitBranch = true;
    private boolean autoCommit = true;
    private String integrationBranch = "main";
    private String remote = "origin";
    private String branchPrefix = "claude";

    // Behavior
    private boolean waitForRateLimitReset = false;
    private int autonomyLevel = 0;

    private String defaultPipeline;
    private Map<String, List<PipelineStep>> pipelines = new LinkedHashMap<>();

    // Legacy single-pipeline form, folded into "default" on load
    private List<PipelineStep> pipeline;

    @JsonIgnore
    private Path projectRoot;

    @JsonIgnore
    public Path resolveStateDir() {
        return resolveDataPath(statePath);
    }

    @JsonIgnore
    public Path resolveLogsDir() {
        return resolveDataPath(logsPath);
    }

    private Path resolveDataPath(String configured) {
        if (configured.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), configured.substring(2)).normalize();
        }
        Path path = Paths.get(configured);
        return path.isAbsolute() ? path : projectRoot.resolve(path).normalize();
    }
}
