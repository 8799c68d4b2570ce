package com.openforge.helium.llm;

/**
 * Conversation mode.  Selects the default provider, the model id and the
 * prompt template.
 *
 *   QA   : answer questions about the current directory from supplied context
 *   AGENT: may call file system tools through MCP
 */
public enum AiMode {
    QA,
    AGENT
}
