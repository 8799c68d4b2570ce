package com.openforge.helium.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.helium.llm.model.ChatRequest;
import com.openforge.helium.llm.model.ChatResponse;
import com.openforge.helium.llm.model.FunctionCallResult;
import com.openforge.helium.llm.model.Message;
import com.openforge.helium.llm.model.StreamingChunk;
import com.openforge.helium.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Stateless HTTP client for one OpenAI-compatible provider.
 *
 * streamChat() posts with "stream": true, calls tokenCallback per content token
 * and returns the assembled ChatResponse (content + native tool_calls) when
 * the stream ends.  The call is synchronous; the tool loop awaits each
 * inference call before it inspects the reply.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final LlmProperties.ProviderConfig config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Streaming chat completion via SSE.
     *
     * @param request       ChatRequest; "stream": true is injected internally
     * @param tokenCallback invoked with each non-empty content token, on the calling thread
     * @return assembled ChatResponse with complete content and tool_calls
     */
    public ChatResponse streamChat(ChatRequest request, Consumer<String> tokenCallback) {
        if (request == null) {
            throw new LlmException("ChatRequest must not be null for provider [%s]"
                    .formatted(config.name()));
        }
        ChatRequest effective = withModel(request);

        ObjectNode body = objectMapper.valueToTree(effective);
        body.put("stream", true);
        String requestBody = serialize(body);
        log.debug("[LlmClient:{}] → streamChat POST model={} body-length={}",
                config.name(), effective.model(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse = send(buildHttpRequest(requestBody),
                HttpResponse.BodyHandlers.ofLines());

        int status = httpResponse.statusCode();
        if (status == 429) {
            throw new LlmRateLimitException(
                    "Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = "";
            Stream<String> lines = httpResponse.body();
            if (lines != null) {
                StringBuilder sb = new StringBuilder();
                lines.limit(20).forEach(line -> {
                    if (sb.length() < 2048) {
                        if (sb.length() > 0) sb.append('\n');
                        sb.append(line);
                    }
                });
                bodySnippet = sb.toString();
            }
            throw new LlmException(
                    "Provider [%s] returned HTTP %d on stream open: %s"
                            .formatted(config.name(), status, bodySnippet));
        }

        return assembleStreamingResponse(httpResponse.body(), tokenCallback, effective.model());
    }

    // ── Streaming assembly ───────────────────────────────────────────────────

    /**
     * Reads the SSE line stream, forwards content deltas and accumulates
     * native tool-call fragments per index.  A fragment without index is keyed
     * on its position in the delta's tool_calls array, and a new id on an
     * occupied index opens a new call.  Calls are ordered by index, then by the
     * order they were opened in.
     */
    ChatResponse assembleStreamingResponse(Stream<String> lines,
                                           Consumer<String> tokenCallback,
                                           String requestedModel) {
        StringBuilder contentBuilder = new StringBuilder();
        Map<Integer, ToolCallAccumulator> openSlots = new HashMap<>();
        List<ToolCallAccumulator>         assembled = new ArrayList<>();
        String responseId    = null;
        String responseModel = null;
        String finishReason  = null;

        for (String line : (Iterable<String>) lines::iterator) {
            if (line.isEmpty() || !line.startsWith(SSE_DATA_PREFIX)) continue;
            String json = line.substring(SSE_DATA_PREFIX.length()).trim();
            if (SSE_DONE.equals(json)) break;

            StreamingChunk chunk;
            try {
                chunk = objectMapper.readValue(json, StreamingChunk.class);
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Failed to parse SSE chunk: {}", config.name(), json);
                continue;
            }

            if (responseId == null)    responseId    = chunk.id();
            if (responseModel == null) responseModel = chunk.model();

            if (chunk.choices() == null || chunk.choices().isEmpty()) continue;

            StreamingChunk.ChunkChoice choice = chunk.choices().get(0);
            if (choice.finishReason() != null) finishReason = choice.finishReason();

            StreamingChunk.DeltaMessage delta = choice.delta();
            if (delta == null) continue;

            if (delta.content() != null && !delta.content().isEmpty()) {
                contentBuilder.append(delta.content());
                tokenCallback.accept(delta.content());
            }

            if (delta.toolCalls() != null) {
                List<StreamingChunk.ToolCallDelta> tcDeltas = delta.toolCalls();
                for (int position = 0; position < tcDeltas.size(); position++) {
                    StreamingChunk.ToolCallDelta tcDelta = tcDeltas.get(position);
                    // Some providers omit index; the position in this delta's array stands in
                    int idx = tcDelta.index() != null ? tcDelta.index() : position;
                    ToolCallAccumulator acc = openSlots.get(idx);
                    if (acc == null || (tcDelta.id() != null && acc.id != null && !acc.id.equals(tcDelta.id()))) {
                        acc = new ToolCallAccumulator(idx);
                        openSlots.put(idx, acc);
                        assembled.add(acc);
                    }
                    if (tcDelta.id()   != null) acc.id   = tcDelta.id();
                    if (tcDelta.type() != null) acc.type = tcDelta.type();
                    if (tcDelta.function() != null) {
                        if (tcDelta.function().name()      != null) acc.name = tcDelta.function().name();
                        if (tcDelta.function().arguments() != null) acc.argsBuilder.append(tcDelta.function().arguments());
                    }
                }
            }
        }

        List<ToolCall> toolCalls = null;
        if (!assembled.isEmpty()) {
            assembled.sort(Comparator.comparingInt(acc -> acc.index));
            toolCalls = new ArrayList<>();
            for (ToolCallAccumulator acc : assembled) {
                toolCalls.add(new ToolCall(acc.id, acc.type,
                        new FunctionCallResult(acc.name, acc.argsBuilder.toString())));
            }
        }

        Message assistantMessage = Message.builder()
                .role("assistant")
                .content(contentBuilder.length() == 0 ? null : contentBuilder.toString())
                .toolCalls(toolCalls)
                .build();

        return ChatResponse.assembled(responseId,
                responseModel != null ? responseModel : requestedModel, assistantMessage, finishReason);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Requests without a model fall back to the provider's agent-mode model. */
    private ChatRequest withModel(ChatRequest request) {
        if (request.model() != null && !request.model().isBlank()) return request;
        String fallbackModel = config.models() != null ? config.models().agent() : null;
        return request.toBuilder().model(fallbackModel).build();
    }

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(stripTrailingSlash(config.baseUrl()) + "/chat/completions"))
                .header("Content-Type", "application/json")
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(config.timeoutSeconds() * 2L))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]: %s"
                    .formatted(config.name(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
    }

    private String serialize(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Accumulator for streaming tool-call assembly ─────────────────────────

    private static class ToolCallAccumulator {
        final int     index;
        String        id   = null;
        String        type = "function";
        String        name = "";
        StringBuilder argsBuilder = new StringBuilder();

        ToolCallAccumulator(int index) {
            this.index = index;
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
