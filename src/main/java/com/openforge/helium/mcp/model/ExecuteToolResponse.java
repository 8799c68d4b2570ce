package com.openforge.helium.mcp.model;

import java.util.List;

/**
 * Backend answer to one tool execution.
 *
 * @param success         the call reached the tool (false for transport-level failures)
 * @param content         result parts in server order
 * @param isError         the tool itself reported a failure
 * @param executionTimeMs server-measured duration, null when not reported
 * @param error           transport or protocol error description, if any
 */
public record ExecuteToolResponse(
        boolean           success,
        List<ToolContent> content,
        boolean           isError,
        Long              executionTimeMs,
        String            error
) {

    public ExecuteToolResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }
}
