package com.openforge.helium.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.openforge.helium.agent.AgentProperties;
import com.openforge.helium.llm.AiMode;
import com.openforge.helium.llm.LlmProperties;
import com.openforge.helium.mcp.McpProperties;
import com.openforge.helium.mcp.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a startup summary once the context is ready.
 *
 * Also applies helium.llm.debug-logs: when true the com.openforge.helium
 * logger is raised to DEBUG so request bodies, SSE lines and JSON-RPC
 * traffic become visible.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    static final String APP_LOGGER = "com.openforge.helium";

    private final LlmProperties   llmProperties;
    private final AgentProperties agentProperties;
    private final McpProperties   mcpProperties;
    private final ToolCatalog     toolCatalog;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        if (llmProperties.debugLogs()) {
            ((Logger) LoggerFactory.getLogger(APP_LOGGER)).setLevel(Level.DEBUG);
        }

        LlmProperties.ResolvedInference qa    = llmProperties.resolve(AiMode.QA);
        LlmProperties.ResolvedInference agent = llmProperties.resolve(AiMode.AGENT);
        int toolCount = mcpProperties.enabled() ? toolCatalog.refresh().size() : 0;

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Helium Agent  —  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Inference                                               ║
                ║    QA             : {}  [{}]  {}
                ║    Agent          : {}  [{}]  {}
                ║    Fallback       : {}
                ║    API keys       : ollama={}  openai-compatible={}
                ║    Debug logs     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    MCP            : {}
                ║    Tools found    : {}
                ║    Max iterations : {}   native tools: {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                qa.provider(), qa.model(), qa.endpoint(),
                agent.provider(), agent.model(), agent.endpoint(),
                llmProperties.fallbackProvider() != null ? llmProperties.fallbackProvider() : "(none)",
                maskKey(llmProperties.ollama() != null ? llmProperties.ollama().apiKey() : null),
                maskKey(llmProperties.openaiCompatible() != null ? llmProperties.openaiCompatible().apiKey() : null),
                llmProperties.debugLogs() ? "✔ enabled" : "✘ disabled",

                mcpProperties.enabled() ? "✔ " + mcpProperties.command() : "✘ disabled",
                toolCount,
                agentProperties.maxToolIterations(),
                agentProperties.nativeTools()
        );
    }

    /**
     * Masks an API key: first 6 chars + "..." + last 4 chars.
     * "(not set)" for empty keys.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
