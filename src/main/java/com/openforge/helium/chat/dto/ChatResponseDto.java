package com.openforge.helium.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.helium.agent.ChatMessage;
import com.openforge.helium.agent.FinalResponse;
import com.openforge.helium.tooling.ToolExecutionRecord;

import java.util.List;

/**
 * Response body for POST /api/chat.  toolExecutions repeats the trace carried
 * on the message so clients need not dig into it.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatResponseDto(
        String                    sessionId,
        ChatMessage               message,
        List<ToolExecutionRecord> toolExecutions,
        String                    model,
        int                       iterations
) {

    public static ChatResponseDto from(String sessionId, FinalResponse response) {
        List<ToolExecutionRecord> executions = response.message().toolExecutions();
        return new ChatResponseDto(
                sessionId,
                response.message(),
                executions != null ? executions : List.of(),
                response.model(),
                response.iterations());
    }
}
