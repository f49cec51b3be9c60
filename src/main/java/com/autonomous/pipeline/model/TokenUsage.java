package com.autonomous.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {
    private long inputTokens;
    private long outputTokens;
    private long cacheCreationInputTokens;
    private long cacheReadInputTokens;

    public void add(TokenUsage other) {
        if (other == null) return;
        inputTokens += other.inputTokens;
        outputTokens += other.outputTokens;
        cacheCreationInputTokens += other.cacheCreationInputTokens;
        cacheReadInputTokens += other.cacheReadInputTokens;
    }

    public boolean isEmpty() {
        return inputTokens == 0 && outputTokens == 0
            && cacheCreationInputTokens == 0 && cacheReadInputTokens == 0;
    }

    /**
     * Adds {@code usage} into the per-model totals of {@code totals}.
     */
    public static void merge(Map<String, TokenUsage> totals, String model, TokenUsage usage) {
        if (usage == null) return;
        totals.computeIfAbsent(model, k -> new TokenUsage()).add(usage);
    }

    public static void mergeAll(Map<String, TokenUsage> totals, Map<String, TokenUsage> usages) {
        if (usages == null) return;
        usages.forEach((model, usage) -> merge(totals, model, usage));
    }
}
