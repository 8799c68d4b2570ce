package com.openforge.helium.agent;

import com.openforge.helium.tooling.ToolExecutionRecord;

/**
 * Observer hooks for one tool-loop invocation.  All methods are invoked on
 * the thread running the loop; chunk callbacks of an inference call always
 * finish before the tool callbacks of the same iteration start.
 */
public interface ToolLoopCallbacks {

    ToolLoopCallbacks NONE = new ToolLoopCallbacks() {};

    /** A new inference request is about to be sent (1-based). */
    default void onIteration(int iteration) {
    }

    /** Partial text streamed by the model. */
    default void onChunk(String chunk) {
    }

    /** Chunks streamed so far in this iteration were discarded; streaming starts over. */
    default void onStreamRestart() {
    }

    /** Record is still EXECUTING. */
    default void beforeToolExecution(ToolExecutionRecord execution) {
    }

    /** Record is SUCCESS or ERROR. */
    default void afterToolExecution(ToolExecutionRecord execution) {
    }
}
