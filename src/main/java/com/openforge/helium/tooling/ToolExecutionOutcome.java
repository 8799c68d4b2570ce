package com.openforge.helium.tooling;

/**
 * Normalized result of one tool execution attempt.
 *
 * content is the concatenated textual output, or the failure description
 * when isError is true.  executionTimeMs is always populated, also on failure.
 */
public record ToolExecutionOutcome(
        String content,
        boolean isError,
        long executionTimeMs
) {

    public static ToolExecutionOutcome success(String content, long executionTimeMs) {
        return new ToolExecutionOutcome(content, false, executionTimeMs);
    }

    public static ToolExecutionOutcome failure(String content, long executionTimeMs) {
        return new ToolExecutionOutcome(content, true, executionTimeMs);
    }
}
