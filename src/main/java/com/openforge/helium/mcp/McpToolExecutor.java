package com.openforge.helium.mcp;

import com.openforge.helium.mcp.model.ExecuteToolRequest;
import com.openforge.helium.mcp.model.ExecuteToolResponse;
import com.openforge.helium.mcp.model.ToolContent;
import com.openforge.helium.tooling.ToolCallRecord;
import com.openforge.helium.tooling.ToolExecutionOutcome;
import com.openforge.helium.tooling.ToolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Adapts the {@link ToolBackend} to the loop's {@link ToolExecutor} contract.
 *
 * Content parts are flattened to text, joined with "\n":
 *   text     → the text
 *   resource → "Resource: uri", followed by "\n" + text when present
 *   other    → ""
 *
 * Never throws.  Backend exceptions become "Error: message" outcomes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolExecutor implements ToolExecutor {

    private final ToolBackend toolBackend;

    @Override
    public ToolExecutionOutcome execute(ToolCallRecord call) {
        long started = System.currentTimeMillis();
        try {
            ExecuteToolResponse response = toolBackend.executeTool(
                    new ExecuteToolRequest(call.name(), call.arguments()));
            long elapsed = response.executionTimeMs() != null
                    ? response.executionTimeMs()
                    : System.currentTimeMillis() - started;

            if (!response.success()) {
                String message = response.error() != null ? response.error() : "Tool execution failed";
                return ToolExecutionOutcome.failure("Error: " + message, elapsed);
            }
            String content = flatten(response.content());
            return response.isError()
                    ? ToolExecutionOutcome.failure(content, elapsed)
                    : ToolExecutionOutcome.success(content, elapsed);
        } catch (RuntimeException e) {
            log.warn("[McpToolExecutor] Tool '{}' failed: {}", call.name(), e.getMessage());
            return ToolExecutionOutcome.failure("Error: " + e.getMessage(),
                    System.currentTimeMillis() - started);
        }
    }

    static String flatten(List<ToolContent> parts) {
        StringBuilder out = new StringBuilder();
        for (ToolContent part : parts) {
            if (out.length() > 0) out.append('\n');
            if ("resource".equals(part.type())) {
                out.append("Resource: ").append(part.uri());
                if (part.text() != null) out.append('\n').append(part.text());
            } else if ("text".equals(part.type()) && part.text() != null) {
                out.append(part.text());
            }
        }
        return out.toString();
    }
}
