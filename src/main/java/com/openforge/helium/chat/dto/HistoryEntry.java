package com.openforge.helium.chat.dto;

import com.openforge.helium.agent.ChatMessage;
import jakarta.validation.constraints.NotNull;

/** One prior turn supplied by the client. */
public record HistoryEntry(
        @NotNull(message = "history role must be set")
        ChatMessage.Role role,

        String content
) {}
