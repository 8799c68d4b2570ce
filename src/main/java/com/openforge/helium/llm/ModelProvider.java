package com.openforge.helium.llm;

/**
 * Inference providers reachable over an OpenAI-compatible HTTP API.
 */
public enum ModelProvider {

    /** Local Ollama daemon, /v1 compatibility endpoint. */
    OLLAMA("ollama"),

    /** Any OpenAI-compatible server (llama.cpp, vLLM, LM Studio, hosted APIs). */
    OPENAI_COMPATIBLE("openaiCompatible");

    private final String instanceName;

    ModelProvider(String instanceName) {
        this.instanceName = instanceName;
    }

    /** Name of the Resilience4j circuit breaker / retry instance for this provider. */
    public String instanceName() {
        return instanceName;
    }
}
