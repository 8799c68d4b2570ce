package com.openforge.helium.mcp;

import com.openforge.helium.llm.model.Tool;
import com.openforge.helium.mcp.model.BackendStatus;
import com.openforge.helium.mcp.model.ToolAnnotations;
import com.openforge.helium.mcp.model.ToolDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cached view of the tools the backend advertises.
 *
 * Loaded lazily on first use and replaced on {@link #refresh()}.  A failed
 * listing leaves the previous snapshot in place; while no listing has ever
 * succeeded nothing is cached, so the next {@link #tools()} asks again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolCatalog {

    static final String NO_TOOLS = "(No tools available)";

    private final ToolBackend toolBackend;

    private volatile List<ToolDescriptor> snapshot;

    public List<ToolDescriptor> refresh() {
        try {
            List<ToolDescriptor> loaded = List.copyOf(toolBackend.listTools());
            snapshot = loaded;
            log.info("[ToolCatalog] Loaded {} tool(s)", loaded.size());
            return loaded;
        } catch (ToolBackendException e) {
            log.warn("[ToolCatalog] Could not list tools: {}", e.getMessage());
            List<ToolDescriptor> previous = snapshot;
            return previous != null ? previous : List.of();
        }
    }

    public List<ToolDescriptor> tools() {
        List<ToolDescriptor> current = snapshot;
        return current != null ? current : refresh();
    }

    public BackendStatus status() {
        boolean running = toolBackend.isRunning();
        return new BackendStatus(running, running ? tools().size() : 0);
    }

    /**
     * One line per tool for the system prompt:
     *   - read_file: Read a file [read-only, idempotent]
     */
    public String formatForPrompt() {
        List<ToolDescriptor> tools = tools();
        if (tools.isEmpty()) return NO_TOOLS;

        StringBuilder out = new StringBuilder();
        for (ToolDescriptor tool : tools) {
            if (out.length() > 0) out.append('\n');
            out.append("- ").append(tool.name())
               .append(": ").append(tool.description() != null ? tool.description() : "");
            String hints = hints(tool.annotations());
            if (!hints.isEmpty()) out.append(" [").append(hints).append(']');
        }
        return out.toString();
    }

    /** Definitions for providers with native tool support. */
    public List<Tool> asFunctionTools() {
        return tools().stream()
                .map(t -> Tool.function(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    private static String hints(ToolAnnotations annotations) {
        if (annotations == null) return "";
        List<String> labels = new ArrayList<>();
        if (annotations.readOnly())    labels.add("read-only");
        if (annotations.idempotent())  labels.add("idempotent");
        if (annotations.destructive()) labels.add("DESTRUCTIVE");
        return String.join(", ", labels);
    }
}
