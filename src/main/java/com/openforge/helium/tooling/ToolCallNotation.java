package com.openforge.helium.tooling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level tool-call protocol for models that do not (or not always) use the
 * native tool_calls field.
 *
 * Two inline encodings are recognised:
 *
 *   WRAPPED : {@code <tool_call>{"id":"call_1","name":"read_file","arguments":{...}}</tool_call>}
 *              id is optional; prose around the JSON inside the tags is tolerated.
 *   RAW     : a bare {"id":"...","name":"...","arguments":{...}} object somewhere
 *              in the text.  Only consulted when no WRAPPED call could be extracted.
 *
 * Results travel back to the model as
 *   {@code <tool_result name="read_file">\n...\n</tool_result>}
 * with an extra error="true" attribute on failure.
 *
 * All methods are pure and never throw on malformed input.
 */
@Slf4j
public final class ToolCallNotation {

    public static final String CALL_OPEN    = "<tool_call>";
    public static final String CALL_CLOSE   = "</tool_call>";
    public static final String RESULT_OPEN  = "<tool_result";
    public static final String RESULT_CLOSE = "</tool_result>";

    private static final Pattern WRAPPED_SPAN =
            Pattern.compile("<tool_call>(.*?)</tool_call>", Pattern.DOTALL);

    private static final Pattern RAW_CALL_SHAPE = Pattern.compile(
            "\\{\\s*\"id\"\\s*:\\s*\"[^\"]+\"\\s*,\\s*\"name\"\\s*:\\s*\"[^\"]+\"\\s*,\\s*\"arguments\"\\s*:\\s*\\{");

    // Balanced braces, one level of nesting at most.
    private static final Pattern RAW_OBJECT =
            Pattern.compile("\\{[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ToolCallNotation() {
    }

    /** Which inline encoding a candidate span came from. */
    public enum Notation {
        WRAPPED,
        RAW
    }

    /**
     * A region of the source text that may hold a tool call.
     *
     * @param start  index of the first character of the span in the source
     * @param end    index one past the last character
     * @param json   the object text to parse; null when a WRAPPED span holds no braces
     */
    public record CandidateSpan(Notation notation, int start, int end, String json) {}

    // ── Detection ────────────────────────────────────────────────────────────

    public static boolean detect(String text) {
        if (text == null || text.isEmpty()) return false;
        return WRAPPED_SPAN.matcher(text).find() || RAW_CALL_SHAPE.matcher(text).find();
    }

    public static boolean hasToolResult(String text) {
        return text != null && text.contains(RESULT_OPEN) && text.contains(RESULT_CLOSE);
    }

    // ── Extraction ───────────────────────────────────────────────────────────

    /**
     * Extract every tool call in the text, in order of appearance.
     * WRAPPED calls win; RAW objects are only scanned when none were found.
     */
    public static List<ToolCallRecord> extract(String text) {
        List<ToolCallRecord> calls = new ArrayList<>();
        if (text == null || text.isEmpty()) return calls;

        for (CandidateSpan span : scanWrapped(text)) {
            ToolCallRecord call = toWrappedCall(span, calls.size());
            if (call != null) calls.add(call);
        }

        if (calls.isEmpty()) {
            for (CandidateSpan span : scanRaw(text)) {
                ToolCallRecord call = toRawCall(span);
                if (call != null) calls.add(call);
            }
            if (!calls.isEmpty()) {
                log.debug("[ToolCallNotation] Recovered {} raw JSON tool call(s) without wrapper tags",
                        calls.size());
            }
        }

        log.debug("[ToolCallNotation] Extracted {} tool call(s) from {} chars",
                calls.size(), text.length());
        return calls;
    }

    public static List<CandidateSpan> scanWrapped(String text) {
        List<CandidateSpan> spans = new ArrayList<>();
        Matcher matcher = WRAPPED_SPAN.matcher(text);
        while (matcher.find()) {
            String inner = matcher.group(1).trim();
            int open  = inner.indexOf('{');
            int close = inner.lastIndexOf('}');
            String json = open >= 0 && close > open ? inner.substring(open, close + 1) : null;
            spans.add(new CandidateSpan(Notation.WRAPPED, matcher.start(), matcher.end(), json));
        }
        return spans;
    }

    public static List<CandidateSpan> scanRaw(String text) {
        List<CandidateSpan> spans = new ArrayList<>();
        Matcher matcher = RAW_OBJECT.matcher(text);
        while (matcher.find()) {
            spans.add(new CandidateSpan(Notation.RAW, matcher.start(), matcher.end(), matcher.group()));
        }
        return spans;
    }

    private static ToolCallRecord toWrappedCall(CandidateSpan span, int index) {
        if (span.json() == null) {
            log.warn("[ToolCallNotation] Dropping <tool_call> without a JSON object at {}", span.start());
            return null;
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(span.json());
        } catch (JsonProcessingException e) {
            log.warn("[ToolCallNotation] Dropping unparseable <tool_call> at {}: {}",
                    span.start(), e.getOriginalMessage());
            return null;
        }

        JsonNode name = node.get("name");
        JsonNode args = node.get("arguments");
        if (!node.isObject() || name == null || !name.isTextual() || name.asText().isBlank()
                || args == null || args.isNull()) {
            log.warn("[ToolCallNotation] Dropping <tool_call> missing name/arguments: {}", span.json());
            return null;
        }

        Map<String, Object> arguments = toArguments(args);
        if (arguments == null) {
            log.warn("[ToolCallNotation] Dropping <tool_call> '{}' with non-object arguments", name.asText());
            return null;
        }

        JsonNode id = node.get("id");
        String callId = id != null && id.isTextual() && !id.asText().isBlank()
                ? id.asText()
                : syntheticId(index);
        return new ToolCallRecord(callId, name.asText(), arguments);
    }

    private static ToolCallRecord toRawCall(CandidateSpan span) {
        JsonNode node;
        try {
            node = MAPPER.readTree(span.json());
        } catch (JsonProcessingException e) {
            log.debug("[ToolCallNotation] Skipping non-JSON brace span at {}", span.start());
            return null;
        }
        if (!isRawToolCall(node)) return null;
        return new ToolCallRecord(
                node.get("id").asText(),
                node.get("name").asText(),
                MAPPER.convertValue(node.get("arguments"), MAP_TYPE));
    }

    private static boolean isRawToolCall(JsonNode node) {
        if (node == null || !node.isObject()) return false;
        JsonNode id   = node.get("id");
        JsonNode name = node.get("name");
        JsonNode args = node.get("arguments");
        return id != null && id.isTextual() && !id.asText().isEmpty()
                && name != null && name.isTextual() && !name.asText().isEmpty()
                && args != null && args.isObject();
    }

    /** Object arguments as-is; a string holding a JSON object is decoded; anything else is rejected. */
    private static Map<String, Object> toArguments(JsonNode args) {
        if (args.isObject()) {
            return MAPPER.convertValue(args, MAP_TYPE);
        }
        if (args.isTextual()) {
            try {
                JsonNode decoded = MAPPER.readTree(args.asText());
                return decoded != null && decoded.isObject() ? MAPPER.convertValue(decoded, MAP_TYPE) : null;
            } catch (JsonProcessingException e) {
                return null;
            }
        }
        return null;
    }

    private static String syntheticId(int index) {
        return "call_%d_%d".formatted(System.currentTimeMillis(), index);
    }

    // ── Display cleanup ──────────────────────────────────────────────────────

    /**
     * Remove all tool-call notation from text meant for display: every WRAPPED
     * span and every RAW object that would be accepted as a tool call.
     * Applied until nothing changes, so strip(strip(x)) == strip(x).
     */
    public static String strip(String text) {
        if (text == null) return "";
        String current = text;
        while (true) {
            String next = stripOnce(current);
            if (next.equals(current)) return next;
            current = next;
        }
    }

    private static String stripOnce(String text) {
        String cleaned = WRAPPED_SPAN.matcher(text).replaceAll("");
        for (CandidateSpan span : scanRaw(cleaned)) {
            if (toRawCall(span) != null) {
                cleaned = cleaned.replace(span.json(), "");
            }
        }
        return cleaned.trim();
    }

    // ── Result envelope ──────────────────────────────────────────────────────

    public static String render(String toolName, String resultText, boolean isError) {
        String body = resultText == null ? "" : resultText;
        if (isError) {
            return "<tool_result name=\"" + toolName + "\" error=\"true\">\n" + body + "\n" + RESULT_CLOSE;
        }
        return "<tool_result name=\"" + toolName + "\">\n" + body + "\n" + RESULT_CLOSE;
    }
}
