package com.openforge.helium.llm.model;

import java.util.List;

/**
 * A /chat/completions result.  Blocking calls deserialize it from the body;
 * streaming calls build it with {@link #assembled} once the SSE stream ends.
 *
 * Only the first choice is ever used: requests never ask for n > 1.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    public static ChatResponse assembled(String id, String model, Message message, String finishReason) {
        return new ChatResponse(id, "chat.completion", null, model,
                List.of(new Choice(0, message, finishReason)), null);
    }

    /** The reply message; a response without choices is a provider bug. */
    public Message firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("Provider returned no message in response " + id);
        }
        return choices.get(0).message();
    }

    public boolean hasToolCalls() {
        if (choices == null || choices.isEmpty()) return false;
        Message message = choices.get(0).message();
        return message != null && message.toolCalls() != null && !message.toolCalls().isEmpty();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    /** Ollama reports token counts on blocking calls only. */
    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
