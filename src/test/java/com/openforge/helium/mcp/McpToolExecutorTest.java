package com.openforge.helium.mcp;

import com.openforge.helium.mcp.model.ExecuteToolRequest;
import com.openforge.helium.mcp.model.ExecuteToolResponse;
import com.openforge.helium.mcp.model.ToolContent;
import com.openforge.helium.tooling.ToolCallRecord;
import com.openforge.helium.tooling.ToolExecutionOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolExecutorTest {

    private ToolBackend     backend;
    private McpToolExecutor executor;

    @BeforeEach
    void setUp() {
        backend = mock(ToolBackend.class);
        executor = new McpToolExecutor(backend);
    }

    @Test
    void shouldForwardNameAndArguments() {
        when(backend.executeTool(any())).thenReturn(
                new ExecuteToolResponse(true, List.of(ToolContent.text("ok")), false, 5L, null));

        executor.execute(new ToolCallRecord("c1", "read_file", Map.of("path", "/tmp/a.txt")));

        ArgumentCaptor<ExecuteToolRequest> captor = ArgumentCaptor.forClass(ExecuteToolRequest.class);
        verify(backend).executeTool(captor.capture());
        assertThat(captor.getValue().toolName()).isEqualTo("read_file");
        assertThat(captor.getValue().arguments()).containsEntry("path", "/tmp/a.txt");
    }

    @Test
    void shouldJoinTextParts() {
        when(backend.executeTool(any())).thenReturn(new ExecuteToolResponse(true,
                List.of(ToolContent.text("[FILE] a.txt"), ToolContent.text("[DIR] src")), false, 9L, null));

        ToolExecutionOutcome outcome = executor.execute(call());

        assertThat(outcome.isError()).isFalse();
        assertThat(outcome.content()).isEqualTo("[FILE] a.txt\n[DIR] src");
        assertThat(outcome.executionTimeMs()).isEqualTo(9L);
    }

    @Test
    void shouldRenderResourceParts() {
        when(backend.executeTool(any())).thenReturn(new ExecuteToolResponse(true, List.of(
                ToolContent.text("intro"),
                ToolContent.resource("file:///tmp/a.txt", "hello", "text/plain"),
                ToolContent.resource("file:///tmp/b.bin", null, null)), false, null, null));

        ToolExecutionOutcome outcome = executor.execute(call());

        assertThat(outcome.content()).isEqualTo(
                "intro\nResource: file:///tmp/a.txt\nhello\nResource: file:///tmp/b.bin");
        assertThat(outcome.executionTimeMs()).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void shouldContributeNothingForOtherPartTypes() {
        when(backend.executeTool(any())).thenReturn(new ExecuteToolResponse(true, List.of(
                ToolContent.text("before"),
                new ToolContent("image", null, null, "image/png"),
                ToolContent.text("after")), false, 1L, null));

        assertThat(executor.execute(call()).content()).isEqualTo("before\n\nafter");
    }

    @Test
    void shouldReportToolErrorAsFailure() {
        when(backend.executeTool(any())).thenReturn(new ExecuteToolResponse(true,
                List.of(ToolContent.text("Access denied - path outside allowed directories")), true, 1L, null));

        ToolExecutionOutcome outcome = executor.execute(call());

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.content()).isEqualTo("Access denied - path outside allowed directories");
    }

    @Test
    void shouldReportUnsuccessfulResponseWithError() {
        when(backend.executeTool(any())).thenReturn(
                new ExecuteToolResponse(false, List.of(), true, 4L, "No result from MCP tool: read_file"));

        ToolExecutionOutcome outcome = executor.execute(call());

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.content()).isEqualTo("Error: No result from MCP tool: read_file");
        assertThat(outcome.executionTimeMs()).isEqualTo(4L);
    }

    @Test
    void shouldNeverThrowWhenBackendFails() {
        when(backend.executeTool(any())).thenThrow(new ToolBackendException("MCP server is not running"));

        ToolExecutionOutcome outcome = executor.execute(call());

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.content()).isEqualTo("Error: MCP server is not running");
        assertThat(outcome.executionTimeMs()).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void shouldFailEveryCallOnUnavailableBackend() {
        McpToolExecutor unavailable = new McpToolExecutor(new UnavailableToolBackend());

        ToolExecutionOutcome outcome = unavailable.execute(call());

        assertThat(outcome.isError()).isTrue();
        assertThat(outcome.content()).startsWith("Error: MCP not initialized");
    }

    private static ToolCallRecord call() {
        return new ToolCallRecord("c1", "read_file", Map.of());
    }
}
