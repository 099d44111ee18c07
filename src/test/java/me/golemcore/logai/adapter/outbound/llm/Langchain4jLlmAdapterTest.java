package me.golemcore.logai.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.logai.domain.exception.InvalidRequestException;
import me.golemcore.logai.domain.exception.ProviderUnavailableException;
import me.golemcore.logai.domain.model.LlmChunk;
import me.golemcore.logai.domain.model.LlmRequest;
import me.golemcore.logai.domain.model.LlmResponse;
import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.model.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jLlmAdapterTest {

    private static final String MODEL = "gpt-4o-mini";
    private static final String FETCH_LOGS = "fetch_logs";

    private ChatModel chatModel;
    private StreamingChatModel streamingModel;
    private Langchain4jLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        streamingModel = mock(StreamingChatModel.class);
        adapter = new Langchain4jLlmAdapter(new ModelSelection("openai", MODEL, 0.2), chatModel, streamingModel,
                new ObjectMapper());
    }

    private static LlmRequest request(List<Message> messages, List<ToolDefinition> tools) {
        return LlmRequest.builder()
                .model(MODEL)
                .systemPrompt("You are a log analysis assistant.")
                .messages(messages)
                .tools(tools)
                .build();
    }

    private static Message user(String text) {
        return Message.builder().role(Message.ROLE_USER).content(text).build();
    }

    private static ToolDefinition fetchLogsDefinition() {
        return ToolDefinition.builder()
                .name(FETCH_LOGS)
                .description("Fetch log events")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "log_group", Map.of("type", "string", "description", "Log group"),
                                "limit", Map.of("type", "integer", "description", "Max events"),
                                "order", Map.of("type", "string", "enum", List.of("asc", "desc"))),
                        "required", List.of("log_group")))
                .build();
    }

    // ==================== Identity ====================

    @Test
    void shouldExposeSelection() {
        assertEquals("openai", adapter.getProviderId());
        assertEquals(MODEL, adapter.getCurrentModel());
        assertTrue(adapter.isAvailable());
    }

    // ==================== Request conversion ====================

    @Test
    void shouldPutSystemPromptFirst() {
        ChatRequest chatRequest = adapter.toChatRequest(request(List.of(user("any errors?")), List.of()));

        List<ChatMessage> messages = chatRequest.messages();
        assertEquals(2, messages.size());
        assertEquals("You are a log analysis assistant.", ((SystemMessage) messages.get(0)).text());
        assertEquals("any errors?", ((UserMessage) messages.get(1)).singleText());
        assertTrue(chatRequest.toolSpecifications() == null || chatRequest.toolSpecifications().isEmpty());
    }

    @Test
    void shouldConvertToolCallsAndResults() {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call-1")
                        .name(FETCH_LOGS)
                        .arguments(Map.of("log_group", "/aws/lambda/orders"))
                        .build()))
                .build();
        Message toolResult = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId("call-1")
                .toolName(FETCH_LOGS)
                .content("{\"count\":0}")
                .build();

        List<ChatMessage> messages = adapter.toChatRequest(
                request(List.of(user("errors?"), assistant, toolResult), List.of())).messages();

        AiMessage aiMessage = (AiMessage) messages.get(2);
        ToolExecutionRequest toolRequest = aiMessage.toolExecutionRequests().get(0);
        assertEquals("call-1", toolRequest.id());
        assertEquals(FETCH_LOGS, toolRequest.name());
        assertEquals("{\"log_group\":\"/aws/lambda/orders\"}", toolRequest.arguments());

        ToolExecutionResultMessage resultMessage = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call-1", resultMessage.id());
        assertEquals(FETCH_LOGS, resultMessage.toolName());
        assertEquals("{\"count\":0}", resultMessage.text());
    }

    @Test
    void shouldKeepNudgesAsSystemMessages() {
        Message nudge = Message.builder().role(Message.ROLE_SYSTEM).content("Call the tool now").build();

        List<ChatMessage> messages = adapter.toChatRequest(request(List.of(user("q"), nudge), List.of()))
                .messages();

        assertInstanceOf(SystemMessage.class, messages.get(2));
    }

    @Test
    void shouldConvertToolSchema() {
        ChatRequest chatRequest = adapter.toChatRequest(request(List.of(user("q")), List.of(fetchLogsDefinition())));

        ToolSpecification spec = chatRequest.toolSpecifications().get(0);
        assertEquals(FETCH_LOGS, spec.name());
        JsonObjectSchema parameters = spec.parameters();
        assertEquals(List.of("log_group"), parameters.required());
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("limit"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("order"));
    }

    // ==================== Blocking chat ====================

    @Test
    void shouldParseToolCallsFromResponse() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call-1")
                        .name(FETCH_LOGS)
                        .arguments("{\"log_group\":\"/ecs/api\",\"limit\":50}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());

        LlmResponse response = adapter.chat(request(List.of(user("q")), List.of())).get();

        assertEquals("TOOL_EXECUTION", response.getFinishReason());
        Message.ToolCall call = response.getToolCalls().get(0);
        assertEquals("/ecs/api", call.getArguments().get("log_group"));
        assertEquals(50, call.getArguments().get("limit"));
    }

    @Test
    void shouldTreatMalformedArgumentsAsEmpty() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call-1")
                        .name(FETCH_LOGS)
                        .arguments("{not json")
                        .build())))
                .build());

        LlmResponse response = adapter.chat(request(List.of(user("q")), List.of())).get();

        assertTrue(response.getToolCalls().get(0).getArguments().isEmpty());
    }

    @Test
    void shouldReturnPlainAnswer() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("No errors in the last hour."))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(request(List.of(user("q")), List.of())).get();

        assertEquals("No errors in the last hour.", response.getContent());
        assertNull(response.getToolCalls());
        assertEquals(MODEL, response.getModel());
    }

    @Test
    void shouldMapBlockingFailures() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("429 Too Many Requests"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(List.of(user("q")), List.of())).get());

        assertInstanceOf(ProviderUnavailableException.class, error.getCause());
        assertEquals("Rate limited by openai", error.getCause().getMessage());
    }

    // ==================== Streaming ====================

    @Test
    void shouldStreamPartialsThenFinalChunk() {
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Two ");
            handler.onPartialResponse("");
            handler.onPartialResponse("errors.");
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from("Two errors."))
                    .finishReason(FinishReason.STOP)
                    .build());
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.chatStream(request(List.of(user("q")), List.of())))
                .expectNextMatches(chunk -> "Two ".equals(chunk.getText()) && !chunk.isDone())
                .expectNextMatches(chunk -> "errors.".equals(chunk.getText()))
                .expectNextMatches(chunk -> chunk.isDone() && chunk.getText() == null
                        && "STOP".equals(chunk.getFinishReason()))
                .verifyComplete();
    }

    @Test
    void shouldStreamToolCallsInFinalChunk() {
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                            .id("call-7")
                            .name("list_log_groups")
                            .arguments("{}")
                            .build())))
                    .finishReason(FinishReason.TOOL_EXECUTION)
                    .build());
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.chatStream(request(List.of(user("q")), List.of())))
                .expectNextMatches((LlmChunk chunk) -> chunk.isDone()
                        && "call-7".equals(chunk.getToolCalls().get(0).getId()))
                .verifyComplete();
    }

    @Test
    void shouldMapStreamingErrors() {
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onError(new dev.langchain4j.exception.InvalidRequestException("context length exceeded"));
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.chatStream(request(List.of(user("q")), List.of())))
                .expectErrorMatches(error -> error instanceof InvalidRequestException
                        && error.getMessage().contains("context length exceeded"))
                .verify();
    }

    // ==================== Error mapping ====================

    @Test
    void shouldMapWrappedRateLimit() {
        RuntimeException mapped = adapter.mapError(
                new RuntimeException("call failed", new RateLimitException("slow down")));

        assertInstanceOf(ProviderUnavailableException.class, mapped);
        assertEquals("Rate limited by openai", mapped.getMessage());
    }

    @Test
    void shouldMapUnknownFailureToProviderUnavailable() {
        RuntimeException mapped = adapter.mapError(new IllegalStateException("connection reset"));

        assertInstanceOf(ProviderUnavailableException.class, mapped);
        assertEquals("openai call failed: connection reset", mapped.getMessage());
    }

    @Test
    void shouldPassDomainErrorsThrough() {
        ProviderUnavailableException original = new ProviderUnavailableException("down", null);

        assertSame(original, adapter.mapError(original));
    }
}
