package com.openforge.helium.config;

import com.openforge.helium.llm.LlmClient;
import com.openforge.helium.llm.ModelProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class Resilience4jConfigTest {

    private final Resilience4jConfig config = new Resilience4jConfig();

    @Test
    void shouldRetryRateLimitsAndNetworkErrorsOnly() {
        assertThat(Resilience4jConfig.isTransient(new LlmClient.LlmRateLimitException("429"))).isTrue();
        assertThat(Resilience4jConfig.isTransient(
                new LlmClient.LlmException("network", new IOException("reset")))).isTrue();
        assertThat(Resilience4jConfig.isTransient(new LlmClient.LlmException("HTTP 400"))).isFalse();
        assertThat(Resilience4jConfig.isTransient(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void shouldRegisterOneInstancePerProvider() {
        CircuitBreakerRegistry breakers = config.circuitBreakerRegistry();
        RetryRegistry retries = config.retryRegistry();

        for (ModelProvider provider : ModelProvider.values()) {
            assertThat(breakers.find(provider.instanceName())).isPresent();
            assertThat(retries.find(provider.instanceName())).isPresent();
        }
        assertThat(retries.retry(ModelProvider.OLLAMA.instanceName()).getRetryConfig().getMaxAttempts())
                .isEqualTo(3);
    }
}
