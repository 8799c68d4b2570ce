package com.openforge.helium.agent;

import com.openforge.helium.tooling.ToolExecutionRecord;

import java.util.List;

/**
 * The model kept requesting tools until the iteration budget ran out.
 * Carries the execution trace so callers can show what was attempted.
 */
public class ToolLoopExceededException extends RuntimeException {

    private final int maxIterations;
    private final List<ToolExecutionRecord> executions;

    public ToolLoopExceededException(int maxIterations, List<ToolExecutionRecord> executions) {
        super("Tool loop exceeded maximum iterations (%d)".formatted(maxIterations));
        this.maxIterations = maxIterations;
        this.executions = List.copyOf(executions);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public List<ToolExecutionRecord> getExecutions() {
        return executions;
    }
}
