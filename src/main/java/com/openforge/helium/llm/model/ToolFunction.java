package com.openforge.helium.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The "function" sub-object inside a Tool definition.
 *
 * "parameters" is the MCP tool's inputSchema, passed through verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
