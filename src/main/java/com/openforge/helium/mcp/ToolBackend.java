package com.openforge.helium.mcp;

import com.openforge.helium.mcp.model.ExecuteToolRequest;
import com.openforge.helium.mcp.model.ExecuteToolResponse;
import com.openforge.helium.mcp.model.ToolDescriptor;

import java.util.List;

/**
 * Capability-discovery backend that owns the actual tools.
 *
 * Both methods may throw {@link ToolBackendException} when the backend is not
 * reachable; {@link McpToolExecutor} turns that into an error outcome.
 */
public interface ToolBackend {

    /** True while the backend can serve tools/list and tools/call. */
    boolean isRunning();

    List<ToolDescriptor> listTools();

    ExecuteToolResponse executeTool(ExecuteToolRequest request);
}
