package com.openforge.helium.mcp;

import com.openforge.helium.mcp.model.ExecuteToolRequest;
import com.openforge.helium.mcp.model.ExecuteToolResponse;
import com.openforge.helium.mcp.model.ToolDescriptor;

import java.util.List;

/**
 * Backend used when helium.mcp.enabled=false: no tools, every call fails.
 */
public class UnavailableToolBackend implements ToolBackend {

    @Override
    public boolean isRunning() {
        return false;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        return List.of();
    }

    @Override
    public ExecuteToolResponse executeTool(ExecuteToolRequest request) {
        throw new ToolBackendException("MCP not initialized; cannot execute tool '%s'"
                .formatted(request.toolName()));
    }
}
