package com.openforge.helium.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * MCP filesystem server settings, prefix "helium.mcp".
 *
 * helium:
 *   mcp:
 *     enabled: true
 *     command: npx -y @modelcontextprotocol/server-filesystem
 *     allowed-directories: [/home/me/projects]
 *     env: { NODE_OPTIONS: --max-old-space-size=256 }
 *
 * The allowed directories are appended to the command as arguments; the
 * server enforces the sandbox, not this process.
 */
@ConfigurationProperties(prefix = "helium.mcp")
public record McpProperties(
        @DefaultValue("false") boolean enabled,
        String command,
        @DefaultValue List<String> allowedDirectories,
        @DefaultValue Map<String, String> env,
        @DefaultValue("30") int startupTimeoutSeconds,
        @DefaultValue("60") int requestTimeoutSeconds
) {}
