package com.autonomous.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A post-step validation. Which of {@code path} / {@code command} applies depends on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckConfig {

    public enum Expect {
        @JsonProperty("pass") PASS,
        @JsonProperty("fail") FAIL
    }

    private CheckType type;
    private String path;
    private String command;
    @Builder.Default
    private Expect expect = Expect.PASS;

    public static CheckConfig none() {
        return CheckConfig.builder().type(CheckType.NONE).build();
    }

    public static CheckConfig fileExists(String path) {
        return CheckConfig.builder().type(CheckType.FILE_EXISTS).path(path).build();
    }

    public static CheckConfig shell(String command, Expect expect) {
        return CheckConfig.builder().type(CheckType.SHELL).command(command).expect(expect).build();
    }
}
