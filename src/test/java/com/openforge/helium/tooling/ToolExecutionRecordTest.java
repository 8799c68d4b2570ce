package com.openforge.helium.tooling;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolExecutionRecordTest {

    private final ToolCallRecord call = new ToolCallRecord("c1", "read_file", Map.of("path", "/a"));

    @Test
    void shouldStartExecuting() {
        ToolExecutionRecord record = ToolExecutionRecord.executing(call);

        assertThat(record.status()).isEqualTo(ToolExecutionRecord.ExecutionStatus.EXECUTING);
        assertThat(record.toolName()).isEqualTo("read_file");
        assertThat(record.arguments()).containsEntry("path", "/a");
        assertThat(record.result()).isNull();
        assertThat(record.executionTimeMs()).isNull();
    }

    @Test
    void shouldCompleteWithSuccess() {
        ToolExecutionRecord done = ToolExecutionRecord.executing(call)
                .complete(ToolExecutionOutcome.success("content", 12));

        assertThat(done.status()).isEqualTo(ToolExecutionRecord.ExecutionStatus.SUCCESS);
        assertThat(done.result()).isEqualTo("content");
        assertThat(done.error()).isNull();
        assertThat(done.executionTimeMs()).isEqualTo(12L);
    }

    @Test
    void shouldCompleteWithError() {
        ToolExecutionRecord done = ToolExecutionRecord.executing(call)
                .complete(ToolExecutionOutcome.failure("Error: no such file", 3));

        assertThat(done.status()).isEqualTo(ToolExecutionRecord.ExecutionStatus.ERROR);
        assertThat(done.error()).isEqualTo("Error: no such file");
        assertThat(done.result()).isEqualTo("Error: no such file");
    }

    @Test
    void shouldRejectSecondCompletion() {
        ToolExecutionRecord done = ToolExecutionRecord.executing(call)
                .complete(ToolExecutionOutcome.success("x", 1));

        assertThatThrownBy(() -> done.complete(ToolExecutionOutcome.success("y", 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("read_file");
    }
}
