package com.openforge.helium.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Native tool definition in the request's "tools" array:
 *   {"type": "function", "function": {"name", "description", "parameters"}}
 *
 * Only attached when helium.agent.native-tools=true; otherwise tools are
 * described to the model in the system prompt.
 */
public record Tool(
        String type,
        ToolFunction function
) {

    public static Tool ofFunction(ToolFunction function) {
        return new Tool("function", function);
    }

    /** parameters is the MCP tool's inputSchema. */
    public static Tool function(String name, String description, JsonNode parameters) {
        return ofFunction(new ToolFunction(name, description, parameters));
    }
}
