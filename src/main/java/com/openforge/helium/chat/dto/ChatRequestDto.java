package com.openforge.helium.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.helium.llm.AiMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/chat.
 *
 * @param query         the user's question or instruction
 * @param mode          QA or AGENT; AGENT when omitted
 * @param history       earlier turns, oldest first
 * @param currentPath   directory the user is looking at
 * @param fsContext     free-form description of that directory
 * @param sessionId     STOMP topic key; generated when omitted
 * @param maxIterations overrides helium.agent.max-tool-iterations
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatRequestDto(

        @NotBlank(message = "query must not be blank")
        @Size(max = 8000, message = "query must not exceed 8000 characters")
        String query,

        AiMode mode,

        List<@Valid HistoryEntry> history,

        String currentPath,

        String fsContext,

        String sessionId,

        @Min(value = 1, message = "maxIterations must be at least 1")
        @Max(value = 20, message = "maxIterations must not exceed 20")
        Integer maxIterations
) {}
