package com.openforge.helium.llm.model;

/**
 * The "function" sub-object inside a native ToolCall.
 *
 * "arguments" arrives as a JSON-encoded string, e.g.
 *   name      = "read_file"
 *   arguments = "{\"path\":\"/tmp/a.txt\"}"
 * The tool loop decodes it into a map before execution.
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
