package com.openforge.helium.agent;

import com.openforge.helium.llm.model.ToolCall;

import java.util.List;

/**
 * One completion from the inference backend.
 *
 * @param message         assistant message with the raw text content
 * @param nativeToolCalls structured tool calls from the provider's tool_calls
 *                        field (arguments still JSON-encoded); empty if none
 * @param model           model id that produced the completion
 */
public record InferenceResponse(
        ChatMessage    message,
        List<ToolCall> nativeToolCalls,
        String         model
) {

    public InferenceResponse {
        nativeToolCalls = nativeToolCalls == null ? List.of() : List.copyOf(nativeToolCalls);
    }

    public boolean hasNativeToolCalls() {
        return !nativeToolCalls.isEmpty();
    }
}
