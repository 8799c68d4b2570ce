package com.openforge.helium.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A single entry of the conversation as sent over the wire.
 *
 * role variants used here:
 *   "system"   : persona / instructions built from a prompt template
 *   "user"     : human turn, and tool results in the tool_result envelope
 *   "assistant": model reply; may carry native tool_calls
 *
 * Tool results travel as "user" messages, never as role "tool".
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Native tool calls; present only on assistant messages. */
        List<ToolCall> toolCalls
) {

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }
}
