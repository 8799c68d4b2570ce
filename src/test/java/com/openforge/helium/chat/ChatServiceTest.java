package com.openforge.helium.chat;

import com.openforge.helium.agent.ChatMessage;
import com.openforge.helium.agent.FinalResponse;
import com.openforge.helium.agent.InferenceRequest;
import com.openforge.helium.agent.ToolLoopCallbacks;
import com.openforge.helium.agent.ToolLoopExceededException;
import com.openforge.helium.agent.ToolLoopService;
import com.openforge.helium.agent.event.ChatEvent;
import com.openforge.helium.agent.event.EventType;
import com.openforge.helium.chat.dto.ChatRequestDto;
import com.openforge.helium.chat.dto.ChatResponseDto;
import com.openforge.helium.chat.dto.HistoryEntry;
import com.openforge.helium.llm.AiMode;
import com.openforge.helium.mcp.ToolCatalog;
import com.openforge.helium.websocket.ChatEventPublisher;
import com.openforge.helium.workspace.DirectorySummarizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatServiceTest {

    private ToolLoopService    toolLoopService;
    private ToolCatalog        toolCatalog;
    private ChatEventPublisher  publisher;
    private DirectorySummarizer directorySummarizer;
    private ChatService         chatService;

    @BeforeEach
    void setUp() {
        toolLoopService = mock(ToolLoopService.class);
        toolCatalog = mock(ToolCatalog.class);
        publisher = mock(ChatEventPublisher.class);
        directorySummarizer = mock(DirectorySummarizer.class);
        chatService = new ChatService(toolLoopService, toolCatalog, publisher, directorySummarizer);
        when(toolCatalog.formatForPrompt()).thenReturn("- read_file: Read a file [read-only]");
    }

    @Test
    void shouldBuildAgentConversation() {
        ChatRequestDto request = new ChatRequestDto("What is here?", AiMode.AGENT,
                List.of(new HistoryEntry(ChatMessage.Role.USER, "hi"),
                        new HistoryEntry(ChatMessage.Role.ASSISTANT, "hello")),
                "/home/me", "Visible Files: a.txt", null, null);

        List<ChatMessage> messages = chatService.buildConversation(request, AiMode.AGENT);

        assertThat(messages).extracting(ChatMessage::role).containsExactly(
                ChatMessage.Role.SYSTEM, ChatMessage.Role.USER, ChatMessage.Role.ASSISTANT, ChatMessage.Role.USER);
        assertThat(messages.get(0).content())
                .contains("- read_file: Read a file [read-only]")
                .contains("Current Directory: /home/me")
                .contains("Visible Files: a.txt");
        assertThat(messages.get(3).content()).isEqualTo("What is here?");
        verify(directorySummarizer, never()).summarize(any());
    }

    @Test
    void shouldSummarizeCurrentPathWhenNoContextGiven() {
        when(directorySummarizer.summarize("/home/me/project"))
                .thenReturn("Directory: /home/me/project (2 files, 10 B)\n[FILE] a.txt (6 B)");
        ChatRequestDto request = new ChatRequestDto("What is here?", AiMode.QA, null,
                "/home/me/project", " ", null, null);

        List<ChatMessage> messages = chatService.buildConversation(request, AiMode.QA);

        assertThat(messages.get(0).content()).contains("[FILE] a.txt (6 B)");
    }

    @Test
    void shouldLeaveContextEmptyWithoutPath() {
        ChatRequestDto request = new ChatRequestDto("Hello", AiMode.QA, null, null, null, null, null);

        chatService.buildConversation(request, AiMode.QA);

        verify(directorySummarizer, never()).summarize(any());
    }

    @Test
    void shouldNotListToolsInQaMode() {
        ChatRequestDto request = new ChatRequestDto("Where am I?", AiMode.QA, null, "/tmp", null, null, null);

        List<ChatMessage> messages = chatService.buildConversation(request, AiMode.QA);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).content()).contains("Current Directory: /tmp");
        verify(toolCatalog, never()).formatForPrompt();
    }

    @Test
    void shouldRunLoopAndPublishFinalAnswer() {
        ChatMessage answer = ChatMessage.assistant("Two files.").withToolExecutions(List.of());
        when(toolLoopService.run(any(InferenceRequest.class), any(ToolLoopCallbacks.class)))
                .thenReturn(new FinalResponse(answer, "qwen2.5-coder:7b", 2));

        ChatResponseDto response = chatService.chat(
                new ChatRequestDto("List /tmp", null, null, "/tmp", null, "session-1", null));

        assertThat(response.sessionId()).isEqualTo("session-1");
        assertThat(response.message().content()).isEqualTo("Two files.");
        assertThat(response.iterations()).isEqualTo(2);
        assertThat(response.toolExecutions()).isEmpty();

        ArgumentCaptor<ChatEvent> events = ArgumentCaptor.forClass(ChatEvent.class);
        verify(publisher).publish(events.capture());
        assertThat(events.getValue().type()).isEqualTo(EventType.FINAL_ANSWER);
        assertThat(events.getValue().sessionId()).isEqualTo("session-1");
    }

    @Test
    void shouldPassExplicitIterationBudget() {
        when(toolLoopService.run(any(InferenceRequest.class), eq(3), any(ToolLoopCallbacks.class)))
                .thenReturn(new FinalResponse(ChatMessage.assistant("ok"), "m", 1));

        ChatResponseDto response = chatService.chat(
                new ChatRequestDto("q", AiMode.AGENT, null, null, null, null, 3));

        assertThat(response.sessionId()).isNotBlank();
        verify(toolLoopService).run(any(InferenceRequest.class), eq(3), any(ToolLoopCallbacks.class));
    }

    @Test
    void shouldPublishErrorBeforeRethrowing() {
        when(toolLoopService.run(any(InferenceRequest.class), any(ToolLoopCallbacks.class)))
                .thenThrow(new ToolLoopExceededException(5, List.of()));

        assertThatThrownBy(() -> chatService.chat(
                new ChatRequestDto("q", AiMode.AGENT, null, null, null, "s-2", null)))
                .isInstanceOf(ToolLoopExceededException.class);

        ArgumentCaptor<ChatEvent> events = ArgumentCaptor.forClass(ChatEvent.class);
        verify(publisher).publish(events.capture());
        assertThat(events.getValue().type()).isEqualTo(EventType.ERROR);
        assertThat(events.getValue().content()).isEqualTo("Tool loop exceeded maximum iterations (5)");
    }

    @Test
    void shouldDefaultToAgentMode() {
        when(toolLoopService.run(any(InferenceRequest.class), any(ToolLoopCallbacks.class)))
                .thenReturn(new FinalResponse(ChatMessage.assistant("ok"), "m", 1));

        chatService.chat(new ChatRequestDto("q", null, null, null, null, null, null));

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(toolLoopService).run(captor.capture(), any(ToolLoopCallbacks.class));
        assertThat(captor.getValue().mode()).isEqualTo(AiMode.AGENT);
        verify(publisher, never()).publish(argThat(e -> e.type() == EventType.ERROR));
    }
}
