package com.openforge.helium.tooling;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Trace entry for one tool execution.
 *
 * Lifecycle:
 *   executing(call)  → status EXECUTING, no result yet
 *   complete(outcome)→ a NEW record in SUCCESS or ERROR
 *
 * A terminal record can never be completed again.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolExecutionRecord(
        String          toolName,
        Map<String, Object> arguments,
        ExecutionStatus status,
        String          result,
        String          error,
        Long            executionTimeMs
) {

    public enum ExecutionStatus {
        EXECUTING,
        SUCCESS,
        ERROR;

        public boolean isTerminal() {
            return this != EXECUTING;
        }
    }

    public static ToolExecutionRecord executing(ToolCallRecord call) {
        return new ToolExecutionRecord(call.name(), call.arguments(),
                ExecutionStatus.EXECUTING, null, null, null);
    }

    public ToolExecutionRecord complete(ToolExecutionOutcome outcome) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution of '%s' already finished with status %s".formatted(toolName, status));
        }
        return new ToolExecutionRecord(
                toolName,
                arguments,
                outcome.isError() ? ExecutionStatus.ERROR : ExecutionStatus.SUCCESS,
                outcome.content(),
                outcome.isError() ? outcome.content() : null,
                outcome.executionTimeMs());
    }
}
