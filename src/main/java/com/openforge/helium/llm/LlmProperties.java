package com.openforge.helium.llm;

import com.openforge.helium.llm.model.GenerationParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "helium.llm" prefix:
 *
 * helium:
 *   llm:
 *     default-provider:
 *       qa: ollama
 *       agent: ollama
 *     fallback-provider: openai-compatible     # optional
 *     ollama:
 *       name: ollama
 *       base-url: http://127.0.0.1:11434/v1
 *       models: { qa: "llama3.2:1B", agent: "qwen2.5-coder:7b" }
 *     openai-compatible:
 *       name: openai-compatible
 *       base-url: http://127.0.0.1:8033/v1
 *       api-key: ${OPENAI_API_KEY:}
 *       models: { qa: openai-compatible-generic, agent: openai-compatible-generic }
 *     parameters: { temperature: 0.7, top-p: 0.9, max-tokens: 2048 }
 *     debug-logs: false
 *
 * Everything is resolved once at startup; the tool loop only ever sees a
 * {@link ResolvedInference}.
 */
@ConfigurationProperties(prefix = "helium.llm")
public record LlmProperties(
        @DefaultValue DefaultProviders defaultProvider,
        ModelProvider fallbackProvider,
        ProviderConfig ollama,
        ProviderConfig openaiCompatible,
        GenerationParameters parameters,
        @DefaultValue("false") boolean debugLogs
) {

    public record DefaultProviders(
            @DefaultValue("OLLAMA") ModelProvider qa,
            @DefaultValue("OLLAMA") ModelProvider agent
    ) {
        public ModelProvider forMode(AiMode mode) {
            return mode == AiMode.AGENT ? agent : qa;
        }
    }

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            ModelIds models,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    public record ModelIds(String qa, String agent) {
        public String forMode(AiMode mode) {
            return mode == AiMode.AGENT ? agent : qa;
        }
    }

    /** Provider, model id, endpoint and sampling parameters for one mode. */
    public record ResolvedInference(
            ModelProvider provider,
            String model,
            String endpoint,
            GenerationParameters parameters
    ) {}

    public ResolvedInference resolve(AiMode mode) {
        return resolve(defaultProvider.forMode(mode), mode);
    }

    public ResolvedInference resolve(ModelProvider provider, AiMode mode) {
        ProviderConfig config = provider(provider);
        return new ResolvedInference(provider, config.models().forMode(mode), config.baseUrl(),
                parameters != null ? parameters : GenerationParameters.DEFAULTS);
    }

    public ProviderConfig provider(ModelProvider provider) {
        ProviderConfig config = switch (provider) {
            case OLLAMA -> ollama;
            case OPENAI_COMPATIBLE -> openaiCompatible;
        };
        if (config == null) {
            throw new IllegalStateException("No configuration for provider " + provider
                    + " under helium.llm");
        }
        return config;
    }
}
