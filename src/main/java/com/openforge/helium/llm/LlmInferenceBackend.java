package com.openforge.helium.llm;

import com.openforge.helium.agent.AgentProperties;
import com.openforge.helium.agent.ChatMessage;
import com.openforge.helium.agent.InferenceBackend;
import com.openforge.helium.agent.InferenceRequest;
import com.openforge.helium.agent.InferenceResponse;
import com.openforge.helium.llm.model.ChatRequest;
import com.openforge.helium.llm.model.ChatResponse;
import com.openforge.helium.llm.model.Message;
import com.openforge.helium.mcp.ToolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Binds the tool loop's {@link InferenceBackend} port to the provider router.
 *
 * Per call:
 *   1. resolve model + sampling parameters for the request's mode
 *   2. map ChatMessages onto the OpenAI wire format
 *   3. attach native tool definitions when helium.agent.native-tools=true
 *   4. stream through {@link LlmRouter}, forwarding content tokens and restarts
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmInferenceBackend implements InferenceBackend {

    private final LlmProperties   llmProperties;
    private final LlmRouter       router;
    private final AgentProperties agentProperties;
    private final ToolCatalog     toolCatalog;

    @Override
    public InferenceResponse infer(InferenceRequest request, Consumer<String> onChunk, Runnable onRestart) {
        LlmProperties.ResolvedInference resolved = llmProperties.resolve(request.mode());

        List<Message> wire = request.messages().stream()
                .map(LlmInferenceBackend::toWire)
                .toList();
        ChatRequest chatRequest = ChatRequest.of(resolved.model(), wire,
                request.parameters() != null ? request.parameters() : resolved.parameters());
        if (agentProperties.nativeTools() && request.mode() == AiMode.AGENT) {
            chatRequest = chatRequest.withTools(toolCatalog.asFunctionTools());
        }

        log.debug("[Inference] mode={} provider={} model={} messages={}",
                request.mode(), resolved.provider(), resolved.model(), wire.size());

        ChatResponse response = router.streamChat(request.mode(), chatRequest, onChunk, onRestart);
        Message reply = response.firstMessage();

        String content = reply != null && reply.content() != null ? reply.content() : "";
        return new InferenceResponse(
                ChatMessage.assistant(content),
                reply != null ? reply.toolCalls() : null,
                response.model());
    }

    static Message toWire(ChatMessage message) {
        return Message.builder()
                .role(message.role().wireName())
                .content(message.content())
                .build();
    }
}
