package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CheckResult {
    private boolean success;
    private String output;

    public static CheckResult passed() {
        return new CheckResult(true, null);
    }

    public static CheckResult failed(String output) {
        return new CheckResult(false, output);
    }
}
