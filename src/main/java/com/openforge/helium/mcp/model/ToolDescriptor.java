package com.openforge.helium.mcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One tool advertised by the MCP server in its tools/list response.
 *
 * inputSchema is a JSON Schema object, kept as a tree so it can be handed to
 * providers with native tool support without remapping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolDescriptor(
        String          name,
        String          description,
        JsonNode        inputSchema,
        ToolAnnotations annotations
) {}
