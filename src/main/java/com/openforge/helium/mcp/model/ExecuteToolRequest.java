package com.openforge.helium.mcp.model;

import java.util.Map;

public record ExecuteToolRequest(
        String toolName,
        Map<String, Object> arguments
) {}
