package com.openforge.helium.agent.event;

/**
 * Classifies every event a chat emits over WebSocket.
 *
 * Flow per iteration: ITERATION_START → THINKING* → (TOOL_CALL → TOOL_RESULT)*,
 * then FINAL_ANSWER or ERROR once.  STREAM_RESET may interrupt the THINKING run.
 */
public enum EventType {

    /** A new inference request is about to be sent. */
    ITERATION_START,

    /** A chunk of streamed model text. */
    THINKING,

    /** THINKING chunks of this iteration so far are void; the model is streaming again. */
    STREAM_RESET,

    /** A tool is about to run. payload = ToolExecutionRecord (EXECUTING). */
    TOOL_CALL,

    /** A tool has finished. payload = ToolExecutionRecord (SUCCESS or ERROR). */
    TOOL_RESULT,

    /** Final answer; the chat request is complete. */
    FINAL_ANSWER,

    /** The chat request failed. content = message. */
    ERROR
}
