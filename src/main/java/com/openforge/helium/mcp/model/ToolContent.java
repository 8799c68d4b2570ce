package com.openforge.helium.mcp.model;

/**
 * One part of a tools/call result.
 *
 *   type = "text"     → text
 *   type = "resource" → uri, optional text and mimeType
 */
public record ToolContent(
        String type,
        String text,
        String uri,
        String mimeType
) {

    public static ToolContent text(String text) {
        return new ToolContent("text", text, null, null);
    }

    public static ToolContent resource(String uri, String text, String mimeType) {
        return new ToolContent("resource", text, uri, mimeType);
    }
}
