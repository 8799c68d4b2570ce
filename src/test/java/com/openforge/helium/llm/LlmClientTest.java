package com.openforge.helium.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.helium.config.AppConfig;
import com.openforge.helium.llm.model.ChatRequest;
import com.openforge.helium.llm.model.ChatResponse;
import com.openforge.helium.llm.model.GenerationParameters;
import com.openforge.helium.llm.model.Message;
import com.openforge.helium.llm.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmClientTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private HttpClient httpClient;
    private LlmClient  client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new LlmClient(httpClient, objectMapper, new LlmProperties.ProviderConfig(
                "ollama", "http://127.0.0.1:11434/v1/", "",
                new LlmProperties.ModelIds("llama3.2:1B", "qwen2.5-coder:7b"), 30));
    }

    @Test
    void shouldAssembleStreamedContent() {
        List<String> tokens = new ArrayList<>();
        Stream<String> lines = Stream.of(
                "data: {\"id\":\"c1\",\"model\":\"qwen2.5-coder:7b\",\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}",
                "",
                ": keep-alive",
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"lo\"}}]}",
                "data: not-json",
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{},\"finish_reason\":\"stop\"}]}",
                "data: [DONE]",
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"ignored\"}}]}");

        ChatResponse response = client.assembleStreamingResponse(lines, tokens::add, "requested");

        assertThat(tokens).containsExactly("Hel", "lo");
        assertThat(response.firstMessage().content()).isEqualTo("Hello");
        assertThat(response.firstMessage().toolCalls()).isNull();
        assertThat(response.choices().get(0).finishReason()).isEqualTo("stop");
        assertThat(response.model()).isEqualTo("qwen2.5-coder:7b");
        assertThat(response.id()).isEqualTo("c1");
    }

    @Test
    void shouldAssembleNativeToolCallFragmentsByIndex() {
        Stream<String> lines = Stream.of(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":1,\"id\":\"call_b\",\"type\":\"function\",\"function\":{\"name\":\"list_directory\",\"arguments\":\"\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_a\",\"function\":{\"name\":\"read_file\",\"arguments\":\"{\\\"pa\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"th\\\":\\\"/a\\\"}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":1,\"function\":{\"arguments\":\"{}\"}}]},\"finish_reason\":\"tool_calls\"}]}",
                "data:[DONE]");

        ChatResponse response = client.assembleStreamingResponse(lines, token -> { }, "qwen2.5-coder:7b");

        Message message = response.firstMessage();
        assertThat(message.content()).isNull();
        assertThat(message.toolCalls()).hasSize(2);
        assertThat(message.toolCalls().get(0).id()).isEqualTo("call_a");
        assertThat(message.toolCalls().get(0).type()).isEqualTo("function");
        assertThat(message.toolCalls().get(0).function().name()).isEqualTo("read_file");
        assertThat(message.toolCalls().get(0).function().arguments()).isEqualTo("{\"path\":\"/a\"}");
        assertThat(message.toolCalls().get(1).id()).isEqualTo("call_b");
        assertThat(message.toolCalls().get(1).function().arguments()).isEqualTo("{}");
        assertThat(response.model()).isEqualTo("qwen2.5-coder:7b");
        assertThat(response.hasToolCalls()).isTrue();
    }

    @Test
    void shouldKeepCallsWithoutIndexApartByPosition() {
        Stream<String> lines = Stream.of(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":["
                        + "{\"id\":\"call_a\",\"type\":\"function\",\"function\":{\"name\":\"read_file\",\"arguments\":\"{\\\"path\\\":\\\"/a\\\"}\"}},"
                        + "{\"id\":\"call_b\",\"type\":\"function\",\"function\":{\"name\":\"list_directory\",\"arguments\":\"{\\\"path\\\":\\\"/b\\\"}\"}}"
                        + "]},\"finish_reason\":\"tool_calls\"}]}",
                "data: [DONE]");

        List<ToolCall> calls = client.assembleStreamingResponse(lines, token -> { }, "m").firstMessage().toolCalls();

        assertThat(calls).hasSize(2);
        assertThat(calls.get(0).id()).isEqualTo("call_a");
        assertThat(calls.get(0).function().name()).isEqualTo("read_file");
        assertThat(calls.get(0).function().arguments()).isEqualTo("{\"path\":\"/a\"}");
        assertThat(calls.get(1).id()).isEqualTo("call_b");
        assertThat(calls.get(1).function().name()).isEqualTo("list_directory");
        assertThat(calls.get(1).function().arguments()).isEqualTo("{\"path\":\"/b\"}");
    }

    @Test
    void shouldStartNewCallWhenIdChangesOnSameIndex() {
        Stream<String> lines = Stream.of(
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"id\":\"call_a\",\"function\":{\"name\":\"read_file\",\"arguments\":\"{\\\"path\\\"\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"function\":{\"arguments\":\":\\\"/a\\\"}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"id\":\"call_b\",\"function\":{\"name\":\"delete_file\",\"arguments\":\"{\\\"path\\\":\\\"/b\\\"}\"}}]}}]}",
                "data: [DONE]");

        List<ToolCall> calls = client.assembleStreamingResponse(lines, token -> { }, "m").firstMessage().toolCalls();

        assertThat(calls).extracting(ToolCall::id).containsExactly("call_a", "call_b");
        assertThat(calls.get(0).function().name()).isEqualTo("read_file");
        assertThat(calls.get(0).function().arguments()).isEqualTo("{\"path\":\"/a\"}");
        assertThat(calls.get(1).function().name()).isEqualTo("delete_file");
        assertThat(calls.get(1).function().arguments()).isEqualTo("{\"path\":\"/b\"}");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPostStreamingRequestToCompletionsEndpoint() throws Exception {
        HttpResponse<Stream<String>> httpResponse = mock(HttpResponse.class);
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(Stream.of(
                "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}", "data: [DONE]"));
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        ChatResponse response = client.streamChat(request(null), token -> { });

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest sent = captor.getValue();
        assertThat(sent.uri().toString()).isEqualTo("http://127.0.0.1:11434/v1/chat/completions");
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.headers().firstValue("Authorization")).isEmpty();
        assertThat(response.firstMessage().content()).isEqualTo("ok");
        assertThat(response.model()).isEqualTo("qwen2.5-coder:7b");
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRaiseRateLimitOn429() throws Exception {
        HttpResponse<Stream<String>> httpResponse = mock(HttpResponse.class);
        when(httpResponse.statusCode()).thenReturn(429);
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.streamChat(request("m"), token -> { }))
                .isInstanceOf(LlmClient.LlmRateLimitException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldIncludeBodySnippetOnHttpError() throws Exception {
        HttpResponse<Stream<String>> httpResponse = mock(HttpResponse.class);
        when(httpResponse.statusCode()).thenReturn(404);
        when(httpResponse.body()).thenReturn(Stream.of("{\"error\":\"model 'm' not found\"}"));
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.streamChat(request("m"), token -> { }))
                .isInstanceOf(LlmClient.LlmException.class)
                .hasMessageContaining("HTTP 404")
                .hasMessageContaining("model 'm' not found");
    }

    @Test
    void shouldWrapNetworkFailures() throws Exception {
        doThrow(new IOException("Connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client.streamChat(request("m"), token -> { }))
                .isInstanceOf(LlmClient.LlmException.class)
                .hasMessageContaining("Connection refused")
                .hasCauseInstanceOf(IOException.class);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    private static ChatRequest request(String model) {
        return ChatRequest.of(model, List.of(Message.user("hi")), GenerationParameters.DEFAULTS);
    }
}
