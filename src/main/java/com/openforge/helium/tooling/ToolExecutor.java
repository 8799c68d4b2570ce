package com.openforge.helium.tooling;

/**
 * Performs the side effect behind a parsed tool call.
 *
 * Implementations must not throw: every failure, including an unknown tool
 * name or an unreachable backend, is reported as an error outcome carrying
 * the elapsed time of the attempt.
 */
public interface ToolExecutor {

    ToolExecutionOutcome execute(ToolCallRecord call);
}
