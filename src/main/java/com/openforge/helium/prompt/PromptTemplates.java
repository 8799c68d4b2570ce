package com.openforge.helium.prompt;

import com.openforge.helium.llm.AiMode;

import java.util.List;
import java.util.Map;

/**
 * Built-in prompt templates for the two modes.
 *
 * QA    : answers questions about the directory the user is looking at, no tools.
 * AGENT : same context plus the tool list and the tool_call notation.
 */
public final class PromptTemplates {

    public static final String CURRENT_PATH = "current_path";
    public static final String FS_CONTEXT   = "fs_context";
    public static final String USER_QUERY   = "user_query";
    public static final String MCP_TOOLS    = "mcp_tools";

    public static final PromptTemplate QA = new PromptTemplate(
            "qa-default",
            "File System QA",
            AiMode.QA,
            """
            You are Helium, an intelligent file system assistant.
            Your goal is to help the user manage and understand their files based EXACTLY on the context provided.
            The context below is the REAL-TIME state of the user's current directory.

            Current Directory: {current_path}

            Context Information:
            {fs_context}

            Instructions:
            - You are NOT a generic AI. You are a tool integrated into this specific file explorer.
            - Always assume the "Visible Files" list is what the user is looking at RIGHT NOW.
            - Answer specific questions about file sizes, dates, and types using the provided metadata.
            - If the user asks "Where am I?", look at the "Current Directory" and answer confidently.
            - Be concise and direct.""",
            "{user_query}",
            List.of(FS_CONTEXT, CURRENT_PATH, USER_QUERY));

    public static final PromptTemplate AGENT = new PromptTemplate(
            "agent-default",
            "File System Agent",
            AiMode.AGENT,
            """
            You are an AI agent with access to file system operations via tools. \
            You can help users manage, analyze, and organize their files.

            Available Tools:
            {mcp_tools}

            To use a tool, reply with one block per call:
            <tool_call>{"id": "call_1", "name": "tool_name", "arguments": {"param": "value"}}</tool_call>
            Results come back as <tool_result name="tool_name">...</tool_result>.
            When you have everything you need, answer without any tool_call block.

            Guidelines:
            - Think step-by-step before using tools
            - Use tools to gather information before answering
            - Explain what you're doing and why
            - Be cautious with destructive operations
            - Always confirm before deleting or moving files

            Current Directory: {current_path}
            File System Context: {fs_context}""",
            "{user_query}",
            List.of(MCP_TOOLS, CURRENT_PATH, FS_CONTEXT, USER_QUERY));

    private PromptTemplates() {
    }

    public static PromptTemplate forMode(AiMode mode) {
        return mode == AiMode.AGENT ? AGENT : QA;
    }

    /**
     * Replaces every "{key}" with its value.  Placeholders without a value are
     * left as they are; a null value counts as "".
     */
    public static String buildPrompt(String template, Map<String, String> variables) {
        String result = template;
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            String value = entry.getValue() != null ? entry.getValue() : "";
            result = result.replace("{" + entry.getKey() + "}", value);
        }
        return result;
    }
}
