package com.openforge.helium.websocket;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for live chat progress.
 *
 * Client flow:
 *   1. connect to ws://host/ws (SockJS fallback at http://host/ws)
 *   2. SUBSCRIBE /topic/chat/{sessionId}, using the sessionId it will send to POST /api/chat
 *   3. receive ChatEvent frames while the request runs
 *
 * The in-memory simple broker serves a single node.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                // dev default; restrict per deployment
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
