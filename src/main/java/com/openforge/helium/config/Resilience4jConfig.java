package com.openforge.helium.config;

import com.openforge.helium.llm.LlmClient;
import com.openforge.helium.llm.ModelProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring, one named instance per provider
 * ("ollama", "openaiCompatible").  LlmRouter decorates each call with the
 * breaker and retry of the provider it targets.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // local models are slow; only calls over 120 s count as slow
                .slowCallDurationThreshold(Duration.ofSeconds(120))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(IOException.class, RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        for (ModelProvider provider : ModelProvider.values()) {
            registry.circuitBreaker(provider.instanceName());
        }
        return registry;
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    /**
     * Retries rate limits and network failures.  LlmClient wraps both in
     * LlmException, so the predicate looks at the type and the cause.
     */
    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                .retryOnException(Resilience4jConfig::isTransient)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        for (ModelProvider provider : ModelProvider.values()) {
            registry.retry(provider.instanceName());
        }
        return registry;
    }

    static boolean isTransient(Throwable e) {
        return e instanceof LlmClient.LlmRateLimitException || e.getCause() instanceof IOException;
    }
}
