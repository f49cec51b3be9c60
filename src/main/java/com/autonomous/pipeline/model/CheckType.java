package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CheckType {
    @JsonProperty("none") NONE,
    @JsonProperty("fileExists") FILE_EXISTS,
    @JsonProperty("shell") SHELL
}
