package com.openforge.helium.chat;

import com.openforge.helium.agent.ChatMessage;
import com.openforge.helium.agent.FinalResponse;
import com.openforge.helium.agent.InferenceRequest;
import com.openforge.helium.agent.ToolLoopService;
import com.openforge.helium.agent.event.ChatEvent;
import com.openforge.helium.chat.dto.ChatRequestDto;
import com.openforge.helium.chat.dto.ChatResponseDto;
import com.openforge.helium.chat.dto.HistoryEntry;
import com.openforge.helium.llm.AiMode;
import com.openforge.helium.mcp.ToolCatalog;
import com.openforge.helium.prompt.PromptTemplate;
import com.openforge.helium.prompt.PromptTemplates;
import com.openforge.helium.websocket.ChatEventPublisher;
import com.openforge.helium.workspace.DirectorySummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a chat request into a tool-loop invocation.
 *
 * Conversation sent to the model:
 *   [system prompt from the mode's template] + history + [user prompt]
 *
 * fs_context is the client's when given, otherwise a summary of currentPath.
 *
 * Progress is streamed to /topic/chat/{sessionId}; failures publish an ERROR
 * event and then propagate to the controller advice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ToolLoopService    toolLoopService;
    private final ToolCatalog        toolCatalog;
    private final ChatEventPublisher publisher;
    private final DirectorySummarizer directorySummarizer;

    public ChatResponseDto chat(ChatRequestDto request) {
        String sessionId = request.sessionId() != null && !request.sessionId().isBlank()
                ? request.sessionId()
                : UUID.randomUUID().toString();
        AiMode mode = request.mode() != null ? request.mode() : AiMode.AGENT;

        InferenceRequest inference = InferenceRequest.of(buildConversation(request, mode), mode);
        EventPublishingCallbacks callbacks = new EventPublishingCallbacks(publisher, sessionId);

        log.info("[Chat] session={} mode={} query={}", sessionId, mode,
                request.query().substring(0, Math.min(80, request.query().length())));
        try {
            FinalResponse response = request.maxIterations() != null
                    ? toolLoopService.run(inference, request.maxIterations(), callbacks)
                    : toolLoopService.run(inference, callbacks);
            publisher.publish(ChatEvent.finalAnswer(sessionId,
                    response.message().content(), response.iterations()));
            return ChatResponseDto.from(sessionId, response);
        } catch (RuntimeException e) {
            log.error("[Chat] session={} failed: {}", sessionId, e.getMessage());
            publisher.publish(ChatEvent.error(sessionId, e.getMessage(), callbacks.currentIteration()));
            throw e;
        }
    }

    List<ChatMessage> buildConversation(ChatRequestDto request, AiMode mode) {
        PromptTemplate template = PromptTemplates.forMode(mode);

        Map<String, String> variables = new HashMap<>();
        variables.put(PromptTemplates.CURRENT_PATH, request.currentPath() != null ? request.currentPath() : "");
        variables.put(PromptTemplates.FS_CONTEXT, fsContext(request));
        variables.put(PromptTemplates.USER_QUERY, request.query());
        if (mode == AiMode.AGENT) {
            variables.put(PromptTemplates.MCP_TOOLS, toolCatalog.formatForPrompt());
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(PromptTemplates.buildPrompt(template.systemPrompt(), variables)));
        if (request.history() != null) {
            for (HistoryEntry entry : request.history()) {
                messages.add(ChatMessage.of(entry.role(), entry.content() != null ? entry.content() : ""));
            }
        }
        messages.add(ChatMessage.user(PromptTemplates.buildPrompt(template.userPrompt(), variables)));
        return messages;
    }

    private String fsContext(ChatRequestDto request) {
        if (request.fsContext() != null && !request.fsContext().isBlank()) {
            return request.fsContext();
        }
        if (request.currentPath() == null || request.currentPath().isBlank()) {
            return "";
        }
        return directorySummarizer.summarize(request.currentPath());
    }
}
