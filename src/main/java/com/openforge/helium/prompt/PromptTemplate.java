package com.openforge.helium.prompt;

import com.openforge.helium.llm.AiMode;

import java.util.List;

/**
 * A system prompt plus user prompt with {placeholder} variables.
 */
public record PromptTemplate(
        String       id,
        String       name,
        AiMode       mode,
        String       systemPrompt,
        String       userPrompt,
        List<String> variables
) {}
