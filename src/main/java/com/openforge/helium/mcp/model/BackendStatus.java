package com.openforge.helium.mcp.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Reachability of the tool backend as reported by GET /api/tools/status.
 * toolCount is 0 while the backend is down.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record BackendStatus(boolean initialized, int toolCount) {}
