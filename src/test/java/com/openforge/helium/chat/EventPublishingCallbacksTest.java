package com.openforge.helium.chat;

import com.openforge.helium.agent.event.ChatEvent;
import com.openforge.helium.agent.event.EventType;
import com.openforge.helium.tooling.ToolCallRecord;
import com.openforge.helium.tooling.ToolExecutionOutcome;
import com.openforge.helium.tooling.ToolExecutionRecord;
import com.openforge.helium.websocket.ChatEventPublisher;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class EventPublishingCallbacksTest {

    @Test
    void shouldTagEventsWithSessionAndIteration() {
        ChatEventPublisher publisher = mock(ChatEventPublisher.class);
        EventPublishingCallbacks callbacks = new EventPublishingCallbacks(publisher, "s-9");
        ToolExecutionRecord pending = ToolExecutionRecord.executing(
                new ToolCallRecord("c", "read_file", Map.of("path", "/a")));

        callbacks.onIteration(2);
        callbacks.onChunk("Hel");
        callbacks.onStreamRestart();
        callbacks.beforeToolExecution(pending);
        callbacks.afterToolExecution(pending.complete(ToolExecutionOutcome.success("text", 3)));

        ArgumentCaptor<ChatEvent> captor = ArgumentCaptor.forClass(ChatEvent.class);
        verify(publisher, times(5)).publish(captor.capture());
        List<ChatEvent> events = captor.getAllValues();
        assertThat(events).extracting(ChatEvent::type).containsExactly(
                EventType.ITERATION_START, EventType.THINKING, EventType.STREAM_RESET,
                EventType.TOOL_CALL, EventType.TOOL_RESULT);
        assertThat(events).allSatisfy(e -> {
            assertThat(e.sessionId()).isEqualTo("s-9");
            assertThat(e.iteration()).isEqualTo(2);
        });
        assertThat(events.get(1).content()).isEqualTo("Hel");
        assertThat(events.get(2).content()).isNull();
        assertThat(events.get(4).content()).isEqualTo("text");
        assertThat(callbacks.currentIteration()).isEqualTo(2);
    }
}
