package com.openforge.helium.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the tool backend:
 *   helium.mcp.enabled=true  → {@link McpStdioClient}, started here, closed on shutdown
 *   otherwise                → {@link UnavailableToolBackend}
 *
 * A server that fails to start does not prevent the application from booting;
 * tool calls then fail with "MCP server is not running".
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(McpProperties.class)
public class McpConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "helium.mcp", name = "enabled", havingValue = "true")
    public McpStdioClient mcpStdioClient(McpProperties properties, ObjectMapper objectMapper) {
        McpStdioClient client = new McpStdioClient(properties, objectMapper);
        try {
            client.start();
        } catch (ToolBackendException e) {
            log.error("[MCP] Filesystem server unavailable, tools disabled until restart: {}", e.getMessage());
        }
        return client;
    }

    @Bean
    @ConditionalOnProperty(prefix = "helium.mcp", name = "enabled", havingValue = "false", matchIfMissing = true)
    public ToolBackend unavailableToolBackend() {
        log.info("[MCP] Disabled (helium.mcp.enabled=false); no tools will be offered.");
        return new UnavailableToolBackend();
    }
}
