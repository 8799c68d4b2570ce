package com.openforge.helium.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.helium.mcp.model.ExecuteToolRequest;
import com.openforge.helium.mcp.model.ExecuteToolResponse;
import com.openforge.helium.mcp.model.ToolAnnotations;
import com.openforge.helium.mcp.model.ToolContent;
import com.openforge.helium.mcp.model.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for the MCP filesystem server, spoken over the child
 * process's stdin/stdout.
 *
 * Lifecycle:
 *   start() : spawn "command dir1 dir2 ...", initialize handshake,
 *              notifications/initialized
 *   listTools() / executeTool(): tools/list and tools/call round trips
 *   close() : fail pending requests, destroy the process
 *
 * One daemon thread reads stdout and completes pending futures by request id;
 * another drains stderr to the DEBUG log.  Callers block on the future with
 * the configured request timeout.
 */
@Slf4j
public class McpStdioClient implements ToolBackend, Closeable {

    private static final String JSONRPC_VERSION      = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String CLIENT_NAME          = "helium-agent";
    private static final String CLIENT_VERSION       = "0.1.0";

    private final McpProperties properties;
    private final ObjectMapper  objectMapper;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private Process        process;
    private BufferedWriter writer;
    private volatile boolean running;

    public McpStdioClient(McpProperties properties, ObjectMapper objectMapper) {
        this.properties   = properties;
        this.objectMapper = objectMapper;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public void start() {
        String command = buildCommand();
        log.info("[MCP] Starting filesystem server: {}", command);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(false);
        pb.environment().putAll(properties.env());

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolBackendException("Failed to start MCP server: " + e.getMessage(), e);
        }
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        startDaemon(this::readLoop, "mcp-reader");
        startDaemon(this::stderrDrain, "mcp-stderr");

        try {
            JsonNode initResult = request("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of("name", CLIENT_NAME, "version", CLIENT_VERSION)),
                    properties.startupTimeoutSeconds());
            log.info("[MCP] Initialized: server={}",
                    initResult != null ? initResult.path("serverInfo").path("name").asText("unknown") : "unknown");
            sendNotification("notifications/initialized");
        } catch (RuntimeException e) {
            log.error("[MCP] Initialization failed, cleaning up: {}", e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        if (process == null) return;
        log.info("[MCP] Closing client");
        running = false;
        failPending(new IOException("MCP client closed"));
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("[MCP] Error closing stdin: {}", e.getMessage());
        }
        process.destroy();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    // ── ToolBackend ──────────────────────────────────────────────────────────

    @Override
    public List<ToolDescriptor> listTools() {
        JsonNode result = request("tools/list", Map.of(), properties.requestTimeoutSeconds());
        List<ToolDescriptor> tools = parseToolDescriptors(result);
        log.info("[MCP] Available tools: {}", tools.stream().map(ToolDescriptor::name).toList());
        return tools;
    }

    @Override
    public ExecuteToolResponse executeTool(ExecuteToolRequest toolRequest) {
        long started = System.currentTimeMillis();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolRequest.toolName());
        params.put("arguments", toolRequest.arguments() != null ? toolRequest.arguments() : Map.of());

        JsonNode result = request("tools/call", params, properties.requestTimeoutSeconds());
        long elapsed = System.currentTimeMillis() - started;
        if (result == null || result.isNull()) {
            return new ExecuteToolResponse(false, List.of(), true, elapsed,
                    "No result from MCP tool: " + toolRequest.toolName());
        }
        boolean isError = result.path("isError").asBoolean(false);
        return new ExecuteToolResponse(true, parseContent(result.get("content")), isError, elapsed, null);
    }

    // ── JSON-RPC plumbing ────────────────────────────────────────────────────

    JsonNode request(String method, Map<String, Object> params, int timeoutSeconds) {
        if (!isRunning()) {
            throw new ToolBackendException("MCP server is not running");
        }
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("jsonrpc", JSONRPC_VERSION);
        message.put("id", id);
        message.put("method", method);
        message.put("params", params);

        try {
            write(objectMapper.writeValueAsString(message));
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (IOException e) {
            throw new ToolBackendException("Failed to send %s: %s".formatted(method, e.getMessage()), e);
        } catch (TimeoutException e) {
            throw new ToolBackendException("%s timed out after %ds".formatted(method, timeoutSeconds), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolBackendException backendException) {
                throw backendException;
            }
            throw new ToolBackendException("%s failed: %s".formatted(method, cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolBackendException("Interrupted while waiting for " + method, e);
        } finally {
            pendingRequests.remove(id);
        }
    }

    private void sendNotification(String method) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        try {
            write(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP] Failed to send notification {}: {}", method, e.getMessage());
        }
    }

    private void write(String json) throws IOException {
        log.debug("[MCP] → {}", json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    dispatch(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP] Reader thread error: {}", e.getMessage());
            }
        } finally {
            running = false;
            failPending(new IOException("MCP process closed"));
        }
    }

    void dispatch(String line) {
        log.debug("[MCP] ← {}", line);
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP] Ignoring non-JSON line from server: {}", e.getOriginalMessage());
            return;
        }
        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.isInt()) {
            log.debug("[MCP] Server notification: {}", message.path("method").asText("unknown"));
            return;
        }
        CompletableFuture<JsonNode> pending = pendingRequests.get(idNode.asInt());
        if (pending == null) {
            log.warn("[MCP] Response for unknown id: {}", idNode.asInt());
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new ToolBackendException(
                    error.path("code").asInt(-1),
                    error.path("message").asText("Unknown MCP error"),
                    null));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void stderrDrain() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP] stderr: {}", line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP] Stderr drain ended: {}", e.getMessage());
            }
        }
    }

    private void failPending(Throwable cause) {
        pendingRequests.values().forEach(f -> f.completeExceptionally(cause));
        pendingRequests.clear();
    }

    private static void startDaemon(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    String buildCommand() {
        if (properties.command() == null || properties.command().isBlank()) {
            throw new ToolBackendException("helium.mcp.command is not set");
        }
        StringBuilder command = new StringBuilder(properties.command().trim());
        for (String dir : properties.allowedDirectories()) {
            command.append(' ').append(shellQuote(dir));
        }
        return command.toString();
    }

    private static String shellQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    List<ToolDescriptor> parseToolDescriptors(JsonNode result) {
        JsonNode toolsNode = result != null ? result.get("tools") : null;
        if (toolsNode == null || !toolsNode.isArray()) return List.of();

        List<ToolDescriptor> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.path("name").asText(null);
            if (name == null || name.isBlank()) continue;

            ToolAnnotations annotations = null;
            JsonNode annotationsNode = toolNode.get("annotations");
            if (annotationsNode != null && annotationsNode.isObject()) {
                annotations = new ToolAnnotations(
                        optionalBoolean(annotationsNode, "readOnlyHint"),
                        optionalBoolean(annotationsNode, "idempotentHint"),
                        optionalBoolean(annotationsNode, "destructiveHint"));
            }
            tools.add(new ToolDescriptor(
                    name,
                    toolNode.path("description").asText(""),
                    toolNode.has("inputSchema") ? toolNode.get("inputSchema")
                            : objectMapper.createObjectNode().put("type", "object"),
                    annotations));
        }
        return tools;
    }

    private static Boolean optionalBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() ? value.asBoolean() : null;
    }

    private static List<ToolContent> parseContent(JsonNode contentNode) {
        if (contentNode == null || !contentNode.isArray()) return List.of();
        List<ToolContent> parts = new ArrayList<>();
        for (JsonNode item : contentNode) {
            String type = item.path("type").asText("text");
            if ("resource".equals(type)) {
                JsonNode resource = item.path("resource");
                parts.add(ToolContent.resource(
                        resource.path("uri").asText(""),
                        resource.path("text").asText(null),
                        resource.path("mimeType").asText(null)));
            } else {
                parts.add(new ToolContent(type, item.path("text").asText(null), null, null));
            }
        }
        return parts;
    }
}
