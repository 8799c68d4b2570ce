package com.openforge.helium.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.helium.llm.model.ChatRequest;
import com.openforge.helium.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Routes inference requests to the provider configured for a mode.
 *
 * Call graph:
 *
 *   streamChat(mode, request, tokenCallback, onRestart)
 *     └─ circuitBreaker[provider] + retry[provider]
 *           └─ client[provider].streamChat(request with provider's model)
 *                 ↓ (any exception, only if helium.llm.fallback-provider is set)
 *     └─ circuitBreaker[fallback] + retry[fallback]
 *           └─ client[fallback].streamChat(request with fallback's model)
 *
 * Streaming note:
 *   Tokens of a failed partial stream may already have reached the callback.
 *   Every later attempt streams from scratch and is preceded by onRestart.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmProperties                  properties;
    private final Map<ModelProvider, LlmClient>  clients = new EnumMap<>(ModelProvider.class);
    private final CircuitBreakerRegistry         circuitBreakers;
    private final RetryRegistry                  retries;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreakerRegistry circuitBreakerRegistry,
                     RetryRegistry retryRegistry) {
        this.properties      = properties;
        this.circuitBreakers = circuitBreakerRegistry;
        this.retries         = retryRegistry;
        if (properties.ollama() != null) {
            clients.put(ModelProvider.OLLAMA, new LlmClient(httpClient, objectMapper, properties.ollama()));
        }
        if (properties.openaiCompatible() != null) {
            clients.put(ModelProvider.OPENAI_COMPATIBLE,
                    new LlmClient(httpClient, objectMapper, properties.openaiCompatible()));
        }
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Streams a completion with the mode's provider.  Each content token is
     * handed to {@code tokenCallback} as it arrives.  When an attempt that
     * already produced tokens is about to be repeated (retry or fallback),
     * {@code onRestart} runs first so consumers can discard the partial text.
     */
    public ChatResponse streamChat(AiMode mode,
                                   ChatRequest request,
                                   Consumer<String> tokenCallback,
                                   Runnable onRestart) {
        AtomicBoolean streamed = new AtomicBoolean();
        Consumer<String> tracking = token -> {
            streamed.set(true);
            tokenCallback.accept(token);
        };
        return route(mode, request, (client, req) -> () -> {
            if (streamed.getAndSet(false)) {
                log.debug("[LlmRouter] Restarting stream after a failed partial attempt");
                onRestart.run();
            }
            return client.streamChat(req, tracking);
        });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    @FunctionalInterface
    private interface CallFactory {
        Supplier<ChatResponse> create(LlmClient client, ChatRequest request);
    }

    private ChatResponse route(AiMode mode, ChatRequest request, CallFactory calls) {
        ModelProvider primary  = properties.defaultProvider().forMode(mode);
        ModelProvider fallback = properties.fallbackProvider();
        try {
            return executeOn(primary, mode, request, calls);
        } catch (LlmClient.LlmException primaryException) {
            if (fallback == null || fallback == primary || !clients.containsKey(fallback)) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Provider {} failed ({}), engaging fallback {}. Cause: {}",
                    primary, primaryException.getClass().getSimpleName(), fallback,
                    primaryException.getMessage());
            return executeOn(fallback, mode, request, calls);
        }
    }

    private ChatResponse executeOn(ModelProvider provider, AiMode mode, ChatRequest request, CallFactory calls) {
        LlmClient client = clients.get(provider);
        if (client == null) {
            throw new LlmClient.LlmException("Provider %s is not configured".formatted(provider));
        }
        String model = properties.resolve(provider, mode).model();
        ChatRequest routed = request.toBuilder().model(model).build();
        return executeWithResilience(
                circuitBreakers.circuitBreaker(provider.instanceName()),
                retries.retry(provider.instanceName()),
                calls.create(client, routed),
                provider);
    }

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic, without AOP proxies or annotations.
     */
    private ChatResponse executeWithResilience(CircuitBreaker cb,
                                               Retry retry,
                                               Supplier<ChatResponse> call,
                                               ModelProvider provider) {
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (LlmClient.LlmException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(provider, e.getMessage()), e);
        }
    }
}
