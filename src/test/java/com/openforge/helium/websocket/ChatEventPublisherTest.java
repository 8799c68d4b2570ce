package com.openforge.helium.websocket;

import com.openforge.helium.agent.event.ChatEvent;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ChatEventPublisherTest {

    private final SimpMessagingTemplate template  = mock(SimpMessagingTemplate.class);
    private final ChatEventPublisher    publisher = new ChatEventPublisher(template);

    @Test
    void shouldPublishToSessionTopic() {
        ChatEvent event = ChatEvent.thinking("abc", "Hel", 1);

        publisher.publish(event);

        verify(template).convertAndSend("/topic/chat/abc", (Object) event);
    }

    @Test
    void shouldSwallowDeliveryFailures() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(template).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> publisher.publish(ChatEvent.error("abc", "x", 0))).doesNotThrowAnyException();
    }
}
