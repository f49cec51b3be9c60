package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStep {
    private String name;
    private String command;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    @Builder.Default
    private List<CheckConfig> check = new ArrayList<>();

    private Integer retry;
    private String model;
    private FileAccess fileAccess;

    public int maxRetries() {
        return retry == null ? 0 : retry;
    }

    public boolean hasMultipleChecks() {
        return check != null && check.size() > 1;
    }
}
