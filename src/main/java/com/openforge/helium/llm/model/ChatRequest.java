package com.openforge.helium.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * Ollama (/v1) and llama.cpp style servers accept the same shape, so a single
 * record covers every supported provider.
 *
 * toolChoice is only set when native tool definitions are attached:
 *   "auto": model decides whether to emit tool_calls
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Double topP,
        Integer maxTokens
) {

    public static ChatRequest of(String model, List<Message> messages, GenerationParameters parameters) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(parameters.temperature())
                .topP(parameters.topP())
                .maxTokens(parameters.maxTokens())
                .build();
    }

    public ChatRequest withTools(List<Tool> tools) {
        if (tools == null || tools.isEmpty()) return this;
        return toBuilder().tools(tools).toolChoice("auto").build();
    }
}
