package com.openforge.helium.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One SSE data frame of a streaming /chat/completions response.
 *
 *   data: {"id":"chatcmpl-1","choices":[{"index":0,"delta":{"content":"Hel"}}]}
 *   ...
 *   data: [DONE]
 *
 * Ollama's OpenAI-compatible endpoint and llama.cpp emit the same frames.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String object,
        Long created,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    /** Only the fields that changed in this frame are non-null. */
    public record DeltaMessage(
            String role,
            String content,
            List<ToolCallDelta> toolCalls
    ) {}

    /**
     * Fragment of a native tool call.  Name and id usually arrive in the first
     * fragment for an index; arguments are spread over many.
     */
    public record ToolCallDelta(
            Integer index,
            String id,
            String type,
            FunctionDelta function
    ) {}

    public record FunctionDelta(
            String name,
            String arguments
    ) {}
}
