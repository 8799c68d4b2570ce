package com.openforge.helium.tooling;

import java.util.Map;

/**
 * One tool invocation requested by the model, normalized regardless of how it
 * arrived (native tool_calls field, wrapped text notation, or raw JSON).
 *
 * Example:
 *   id        = "call_1"
 *   name      = "list_directory"
 *   arguments = {path=/tmp}
 */
public record ToolCallRecord(
        String id,
        String name,
        Map<String, Object> arguments
) {

    public ToolCallRecord {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
