package com.openforge.helium.mcp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Behavioural hints a server may attach to a tool.  Null means "not stated".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ToolAnnotations(
        Boolean readOnlyHint,
        Boolean idempotentHint,
        Boolean destructiveHint
) {

    public boolean readOnly() {
        return Boolean.TRUE.equals(readOnlyHint);
    }

    public boolean idempotent() {
        return Boolean.TRUE.equals(idempotentHint);
    }

    public boolean destructive() {
        return Boolean.TRUE.equals(destructiveHint);
    }
}
