package com.openforge.helium.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.helium.tooling.ToolCallRecord;
import com.openforge.helium.tooling.ToolExecutionRecord;

import java.util.List;
import java.util.UUID;

/**
 * One entry of a conversation handled by the tool loop.
 *
 * Immutable: every change produces a new message.  toolCalls is set on
 * assistant messages that requested tools; toolExecutions carries the full
 * execution trace on the final answer only.
 *
 * Serialized as camelCase regardless of the global SNAKE_CASE strategy so the
 * chat front end sees the same field names in REST responses and events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatMessage(
        String                    id,
        Role                      role,
        String                    content,
        long                      timestamp,
        List<ToolCallRecord>      toolCalls,
        List<ToolExecutionRecord> toolExecutions
) {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT;

        /** Role name on the OpenAI wire format. */
        public String wireName() {
            return name().toLowerCase();
        }
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static ChatMessage of(Role role, String content) {
        return new ChatMessage(UUID.randomUUID().toString(), role, content,
                System.currentTimeMillis(), null, null);
    }

    public static ChatMessage system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return of(Role.ASSISTANT, content);
    }

    /** Tool results go back to the model as user-role messages. */
    public static ChatMessage toolResult(ToolCallRecord call, String renderedResult) {
        long now = System.currentTimeMillis();
        return new ChatMessage("tool-result-%d-%s".formatted(now, call.id()), Role.USER,
                renderedResult, now, null, null);
    }

    // ── Copy helpers ────────────────────────────────────────────────────────

    public ChatMessage withContent(String newContent) {
        return new ChatMessage(id, role, newContent, timestamp, toolCalls, toolExecutions);
    }

    public ChatMessage withToolCalls(List<ToolCallRecord> calls) {
        return new ChatMessage(id, role, content, timestamp, List.copyOf(calls), toolExecutions);
    }

    public ChatMessage withToolExecutions(List<ToolExecutionRecord> executions) {
        return new ChatMessage(id, role, content, timestamp, toolCalls, List.copyOf(executions));
    }
}
