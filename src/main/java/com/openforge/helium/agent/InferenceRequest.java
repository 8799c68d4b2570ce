package com.openforge.helium.agent;

import com.openforge.helium.llm.AiMode;
import com.openforge.helium.llm.model.GenerationParameters;

import java.util.List;

/**
 * Input to one tool-loop invocation and to every inference call it makes.
 *
 * @param messages   conversation so far; the loop appends to a private copy
 * @param mode       selects provider and model
 * @param parameters sampling overrides; null uses the configured defaults
 */
public record InferenceRequest(
        List<ChatMessage>    messages,
        AiMode               mode,
        GenerationParameters parameters
) {

    public InferenceRequest {
        messages = List.copyOf(messages);
        mode = mode == null ? AiMode.AGENT : mode;
    }

    public static InferenceRequest of(List<ChatMessage> messages, AiMode mode) {
        return new InferenceRequest(messages, mode, null);
    }

    public InferenceRequest withMessages(List<ChatMessage> newMessages) {
        return new InferenceRequest(newMessages, mode, parameters);
    }
}
