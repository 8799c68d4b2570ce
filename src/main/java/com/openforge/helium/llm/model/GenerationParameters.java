package com.openforge.helium.llm.model;

/**
 * Sampling parameters forwarded verbatim to the provider.
 * The loop treats them as opaque.
 */
public record GenerationParameters(
        double temperature,
        double topP,
        int maxTokens
) {

    public static final GenerationParameters DEFAULTS = new GenerationParameters(0.7, 0.9, 2048);
}
