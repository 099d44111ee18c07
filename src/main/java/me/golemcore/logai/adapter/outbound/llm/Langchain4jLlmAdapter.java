/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.logai.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.exception.InvalidRequestException;
import me.golemcore.logai.domain.exception.ProviderUnavailableException;
import me.golemcore.logai.domain.model.LlmChunk;
import me.golemcore.logai.domain.model.LlmRequest;
import me.golemcore.logai.domain.model.LlmResponse;
import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.model.ToolDefinition;
import me.golemcore.logai.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * LLM adapter over langchain4j chat models, bound to one provider and model.
 *
 * <p>
 * Handles message and tool schema conversion in both directions. Provider
 * failures are mapped to {@link ProviderUnavailableException}, rejected
 * requests to {@link InvalidRequestException}. No retries happen here.
 */
@Slf4j
public class Langchain4jLlmAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ModelSelection selection;
    private final ChatModel chatModel;
    private final StreamingChatModel streamingModel;
    private final ObjectMapper objectMapper;

    public Langchain4jLlmAdapter(ModelSelection selection, ChatModel chatModel, StreamingChatModel streamingModel,
            ObjectMapper objectMapper) {
        this.selection = selection;
        this.chatModel = chatModel;
        this.streamingModel = streamingModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return selection.provider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return convertResponse(chatModel.chat(toChatRequest(request)));
            } catch (RuntimeException e) {
                throw mapError(e);
            }
        });
    }

    /**
     * Streams partial text as it arrives. After cancellation no further chunk is
     * forwarded; the underlying HTTP call runs to completion in the background.
     */
    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean();
            sink.onCancel(() -> cancelled.set(true));
            ChatRequest chatRequest = toChatRequest(request);
            try {
                streamingModel.chat(chatRequest, new StreamingChatResponseHandler() {
                    @Override
                    public void onPartialResponse(String partialResponse) {
                        if (!cancelled.get() && partialResponse != null && !partialResponse.isEmpty()) {
                            sink.next(LlmChunk.builder().text(partialResponse).done(false).build());
                        }
                    }

                    @Override
                    public void onCompleteResponse(ChatResponse completeResponse) {
                        if (cancelled.get()) {
                            return;
                        }
                        LlmResponse converted = convertResponse(completeResponse);
                        sink.next(LlmChunk.builder()
                                .toolCalls(converted.getToolCalls())
                                .finishReason(converted.getFinishReason())
                                .done(true)
                                .build());
                        sink.complete();
                    }

                    @Override
                    public void onError(Throwable error) {
                        if (!cancelled.get()) {
                            sink.error(mapError(error));
                        }
                    }
                });
            } catch (RuntimeException e) {
                sink.error(mapError(e));
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return selection.model();
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null && streamingModel != null;
    }

    // ==================== CONVERSION ====================

    ChatRequest toChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request));
        List<ToolSpecification> tools = convertTools(request);
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty((String) entry.getKey(),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            List<String> required = (List<String>) schema.get("required");
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }
        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        // Unknown types fall back to string
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }
        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(selection.model())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            // The tool reports the missing parameters back to the model
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    // ==================== ERRORS ====================

    RuntimeException mapError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderUnavailableException || current instanceof InvalidRequestException) {
                return (RuntimeException) current;
            }
            if (current instanceof dev.langchain4j.exception.InvalidRequestException) {
                return new InvalidRequestException(current.getMessage(), error);
            }
            if (current instanceof RateLimitException) {
                return new ProviderUnavailableException("Rate limited by " + selection.provider(), error);
            }
            current = current.getCause();
        }
        log.error("[LLM] {} call failed", selection.provider(), error);
        return new ProviderUnavailableException(selection.provider() + " call failed: " + error.getMessage(), error);
    }
}
