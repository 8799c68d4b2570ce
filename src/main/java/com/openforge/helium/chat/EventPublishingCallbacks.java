package com.openforge.helium.chat;

import com.openforge.helium.agent.ToolLoopCallbacks;
import com.openforge.helium.agent.event.ChatEvent;
import com.openforge.helium.tooling.ToolExecutionRecord;
import com.openforge.helium.websocket.ChatEventPublisher;

/**
 * Forwards loop progress of one chat request to its STOMP topic.
 * One instance per request; not shared across threads.
 */
class EventPublishingCallbacks implements ToolLoopCallbacks {

    private final ChatEventPublisher publisher;
    private final String             sessionId;
    private int iteration;

    EventPublishingCallbacks(ChatEventPublisher publisher, String sessionId) {
        this.publisher = publisher;
        this.sessionId = sessionId;
    }

    @Override
    public void onIteration(int iteration) {
        this.iteration = iteration;
        publisher.publish(ChatEvent.iterationStart(sessionId, iteration));
    }

    @Override
    public void onChunk(String chunk) {
        publisher.publish(ChatEvent.thinking(sessionId, chunk, iteration));
    }

    @Override
    public void onStreamRestart() {
        publisher.publish(ChatEvent.streamReset(sessionId, iteration));
    }

    @Override
    public void beforeToolExecution(ToolExecutionRecord execution) {
        publisher.publish(ChatEvent.toolCall(sessionId, execution, iteration));
    }

    @Override
    public void afterToolExecution(ToolExecutionRecord execution) {
        publisher.publish(ChatEvent.toolResult(sessionId, execution, iteration));
    }

    int currentIteration() {
        return iteration;
    }
}
