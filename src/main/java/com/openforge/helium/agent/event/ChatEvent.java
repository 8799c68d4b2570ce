package com.openforge.helium.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.helium.tooling.ToolExecutionRecord;

/**
 * The single event envelope pushed to /topic/chat/{sessionId}.
 *
 *   content  : chunk text for THINKING, answer for FINAL_ANSWER, message for ERROR
 *   payload  : the execution record for TOOL_CALL / TOOL_RESULT
 *   iteration: 1-based loop iteration, 0 when not tied to one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatEvent(
        String    sessionId,
        EventType type,
        String    content,
        Object    payload,
        int       iteration,
        long      timestamp
) {

    public static ChatEvent iterationStart(String sessionId, int iteration) {
        return new ChatEvent(sessionId, EventType.ITERATION_START, null, null, iteration, now());
    }

    public static ChatEvent thinking(String sessionId, String chunk, int iteration) {
        return new ChatEvent(sessionId, EventType.THINKING, chunk, null, iteration, now());
    }

    public static ChatEvent streamReset(String sessionId, int iteration) {
        return new ChatEvent(sessionId, EventType.STREAM_RESET, null, null, iteration, now());
    }

    public static ChatEvent toolCall(String sessionId, ToolExecutionRecord execution, int iteration) {
        return new ChatEvent(sessionId, EventType.TOOL_CALL, execution.toolName(), execution, iteration, now());
    }

    public static ChatEvent toolResult(String sessionId, ToolExecutionRecord execution, int iteration) {
        return new ChatEvent(sessionId, EventType.TOOL_RESULT, execution.result(), execution, iteration, now());
    }

    public static ChatEvent finalAnswer(String sessionId, String answer, int iteration) {
        return new ChatEvent(sessionId, EventType.FINAL_ANSWER, answer, null, iteration, now());
    }

    public static ChatEvent error(String sessionId, String message, int iteration) {
        return new ChatEvent(sessionId, EventType.ERROR, message, null, iteration, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
