package com.openforge.helium.llm.model;

/**
 * A native tool invocation as delivered in the assistant message's
 * "tool_calls" array.  Converted to a ToolCallRecord by the tool loop.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {}
