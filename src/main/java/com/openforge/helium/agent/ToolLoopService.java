package com.openforge.helium.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.helium.llm.model.ToolCall;
import com.openforge.helium.tooling.ToolCallNotation;
import com.openforge.helium.tooling.ToolCallRecord;
import com.openforge.helium.tooling.ToolExecutionOutcome;
import com.openforge.helium.tooling.ToolExecutionRecord;
import com.openforge.helium.tooling.ToolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The bounded tool-calling loop.
 *
 * Loop shape:
 *   while true:
 *     1. REQUEST : send the conversation to the model, streaming chunks to callbacks
 *     2. INSPECT : native tool_calls? use them.  Otherwise parse the text
 *                   ({@link ToolCallNotation}).  Nothing found → DONE
 *     3. EXECUTE : run every call sequentially in extraction order; failures
 *                   become error results the model can react to
 *     4. APPEND  : assistant message (notation stripped) + one result per call
 *     5. CHECK   : iteration budget spent → {@link ToolLoopExceededException}
 *
 * The service holds no per-invocation state: each run() owns its conversation
 * and execution trace, so concurrent chats need no locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolLoopService {

    public static final int    DEFAULT_MAX_ITERATIONS = 5;
    public static final String USING_TOOLS_PLACEHOLDER = "(Using tools...)";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final InferenceBackend inferenceBackend;
    private final ToolExecutor     toolExecutor;
    private final ObjectMapper     objectMapper;
    private final AgentProperties  agentProperties;

    // ── Entry points ─────────────────────────────────────────────────────────

    /** Runs with the configured budget (helium.agent.max-tool-iterations). */
    public FinalResponse run(InferenceRequest request, ToolLoopCallbacks callbacks) {
        return run(request, agentProperties.maxToolIterations(), callbacks);
    }

    public FinalResponse run(InferenceRequest request, int maxIterations, ToolLoopCallbacks callbacks) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        ToolLoopCallbacks observer = callbacks != null ? callbacks : ToolLoopCallbacks.NONE;

        List<ChatMessage>         conversation = new ArrayList<>(request.messages());
        List<ToolExecutionRecord> executions   = new ArrayList<>();
        int completedIterations = 0;

        while (true) {
            int iteration = completedIterations + 1;
            observer.onIteration(iteration);
            log.debug("[ToolLoop] Iteration {}/{} ({} messages)", iteration, maxIterations, conversation.size());

            // ── REQUEST ──────────────────────────────────────────────────────
            InferenceResponse response = inferenceBackend.infer(
                    request.withMessages(conversation), observer::onChunk, observer::onStreamRestart);

            // ── INSPECT ──────────────────────────────────────────────────────
            List<ToolCallRecord> calls = inspect(response);
            if (calls.isEmpty()) {
                log.info("[ToolLoop] Completed in {} iteration(s), {} tool execution(s).",
                        iteration, executions.size());
                return new FinalResponse(
                        response.message().withToolExecutions(executions),
                        response.model(),
                        iteration);
            }
            log.info("[ToolLoop] Iteration {}: {} tool call(s) {}", iteration, calls.size(),
                    calls.stream().map(ToolCallRecord::name).toList());

            // ── EXECUTE ──────────────────────────────────────────────────────
            List<ChatMessage> results = new ArrayList<>(calls.size());
            for (ToolCallRecord call : calls) {
                ToolExecutionRecord execution = execute(call, observer);
                executions.add(execution);
                boolean failed = execution.status() == ToolExecutionRecord.ExecutionStatus.ERROR;
                results.add(ChatMessage.toolResult(call,
                        ToolCallNotation.render(call.name(), execution.result(), failed)));
            }

            // ── APPEND ───────────────────────────────────────────────────────
            String display = ToolCallNotation.strip(response.message().content());
            conversation.add(response.message()
                    .withContent(display.isEmpty() ? USING_TOOLS_PLACEHOLDER : display)
                    .withToolCalls(calls));
            conversation.addAll(results);

            // ── CHECK ────────────────────────────────────────────────────────
            completedIterations++;
            if (completedIterations >= maxIterations) {
                log.warn("[ToolLoop] Max iterations ({}) reached with tools still requested.", maxIterations);
                throw new ToolLoopExceededException(maxIterations, executions);
            }
        }
    }

    // ── Inspection ───────────────────────────────────────────────────────────

    /**
     * Native tool calls take precedence; text notation is only parsed when the
     * provider sent none, even if the text also contains tool_call tags.
     */
    List<ToolCallRecord> inspect(InferenceResponse response) {
        if (response.hasNativeToolCalls()) {
            return fromNative(response.nativeToolCalls());
        }
        String content = response.message().content();
        if (!ToolCallNotation.detect(content)) {
            return List.of();
        }
        List<ToolCallRecord> calls = ToolCallNotation.extract(content);
        if (calls.isEmpty()) {
            log.debug("[ToolLoop] Tool-call notation detected but nothing extractable; treating as final answer.");
        }
        return calls;
    }

    private List<ToolCallRecord> fromNative(List<ToolCall> nativeCalls) {
        List<ToolCallRecord> calls = new ArrayList<>(nativeCalls.size());
        for (ToolCall toolCall : nativeCalls) {
            String name = toolCall.function() != null ? toolCall.function().name() : null;
            if (name == null || name.isBlank()) {
                log.warn("[ToolLoop] Ignoring native tool call without a function name: id={}", toolCall.id());
                continue;
            }
            String id = toolCall.id() != null && !toolCall.id().isBlank()
                    ? toolCall.id()
                    : "call_%d_%d".formatted(System.currentTimeMillis(), calls.size());
            calls.add(new ToolCallRecord(id, name, decodeArguments(name, toolCall.function().arguments())));
        }
        return calls;
    }

    private Map<String, Object> decodeArguments(String toolName, String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> decoded = objectMapper.readValue(encoded, ARGUMENTS_TYPE);
            return decoded != null ? decoded : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[ToolLoop] Could not decode arguments for '{}', executing with none: {}",
                    toolName, e.getOriginalMessage());
            return Map.of();
        }
    }

    // ── Execution ────────────────────────────────────────────────────────────

    private ToolExecutionRecord execute(ToolCallRecord call, ToolLoopCallbacks observer) {
        ToolExecutionRecord pending = ToolExecutionRecord.executing(call);
        observer.beforeToolExecution(pending);

        long started = System.nanoTime();
        ToolExecutionOutcome outcome;
        try {
            outcome = toolExecutor.execute(call);
        } catch (RuntimeException e) {
            log.error("[ToolLoop] Executor threw for tool '{}': {}", call.name(), e.getMessage(), e);
            outcome = ToolExecutionOutcome.failure("Error: " + e.getMessage(), elapsedMillis(started));
        }
        if (outcome == null) {
            outcome = ToolExecutionOutcome.failure("Error: tool executor returned no result",
                    elapsedMillis(started));
        }

        ToolExecutionRecord finished = pending.complete(outcome);
        if (outcome.isError()) {
            log.warn("[ToolLoop] Tool '{}' failed in {}ms: {}", call.name(), outcome.executionTimeMs(),
                    abbreviate(outcome.content()));
        } else {
            log.info("[ToolLoop] Tool '{}' succeeded in {}ms", call.name(), outcome.executionTimeMs());
        }
        observer.afterToolExecution(finished);
        return finished;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
