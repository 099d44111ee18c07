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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.exception.ConfigurationException;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPort;
import me.golemcore.logai.port.outbound.LlmPortFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds langchain4j chat models for a {@link ModelSelection}.
 *
 * <p>
 * Anthropic uses its native API. OpenAI and Ollama share the OpenAI-compatible
 * client; Ollama points it at the local server unless a base URL is
 * configured.
 */
@Component
@Slf4j
public class LlmAdapterFactory implements LlmPortFactory {

    static final String OLLAMA_DEFAULT_BASE_URL = "http://localhost:11434/v1";
    private static final String OLLAMA_PLACEHOLDER_KEY = "ollama";

    private final LogAiProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;

    public LlmAdapterFactory(LogAiProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmPort create(ModelSelection selection) {
        log.info("[LLM] Creating {} adapter for model {}", selection.provider(), selection.model());
        return switch (selection.provider()) {
        case ModelSelection.PROVIDER_ANTHROPIC -> {
            requireApiKey(selection);
            yield new Langchain4jLlmAdapter(selection, createAnthropicModel(selection),
                    createAnthropicStreamingModel(selection), objectMapper);
        }
        case ModelSelection.PROVIDER_OPENAI -> {
            requireApiKey(selection);
            yield new Langchain4jLlmAdapter(selection,
                    createOpenAiModel(selection, configuredBaseUrl(), settings.getApiKey()),
                    createOpenAiStreamingModel(selection, configuredBaseUrl(), settings.getApiKey()),
                    objectMapper);
        }
        case ModelSelection.PROVIDER_OLLAMA -> {
            String baseUrl = configuredBaseUrl() != null ? configuredBaseUrl() : OLLAMA_DEFAULT_BASE_URL;
            String apiKey = hasApiKey() ? settings.getApiKey() : OLLAMA_PLACEHOLDER_KEY;
            yield new Langchain4jLlmAdapter(selection, createOpenAiModel(selection, baseUrl, apiKey),
                    createOpenAiStreamingModel(selection, baseUrl, apiKey), objectMapper);
        }
        default -> throw new ConfigurationException("Unknown LLM provider: " + selection.provider()
                + ". Supported: openai, anthropic, ollama");
        };
    }

    private ChatModel createAnthropicModel(ModelSelection selection) {
        var builder = AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(selection.model())
                .maxRetries(0) // Provider errors end the turn
                .maxTokens(settings.getMaxTokens())
                .timeout(timeout());
        if (configuredBaseUrl() != null) {
            builder.baseUrl(configuredBaseUrl());
        }
        if (selection.temperature() != null) {
            builder.temperature(selection.temperature());
        }
        return builder.build();
    }

    private StreamingChatModel createAnthropicStreamingModel(ModelSelection selection) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(selection.model())
                .maxTokens(settings.getMaxTokens())
                .timeout(timeout());
        if (configuredBaseUrl() != null) {
            builder.baseUrl(configuredBaseUrl());
        }
        if (selection.temperature() != null) {
            builder.temperature(selection.temperature());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(ModelSelection selection, String baseUrl, String apiKey) {
        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(selection.model())
                .maxRetries(0) // Provider errors end the turn
                .maxTokens(settings.getMaxTokens())
                .timeout(timeout());
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (selection.temperature() != null) {
            builder.temperature(selection.temperature());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiStreamingModel(ModelSelection selection, String baseUrl,
            String apiKey) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(selection.model())
                .maxTokens(settings.getMaxTokens())
                .timeout(timeout());
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        if (selection.temperature() != null) {
            builder.temperature(selection.temperature());
        }
        return builder.build();
    }

    private String configuredBaseUrl() {
        String baseUrl = settings.getBaseUrl();
        return baseUrl != null && !baseUrl.isBlank() ? baseUrl : null;
    }

    private Duration timeout() {
        return settings.getTimeout();
    }

    private void requireApiKey(ModelSelection selection) {
        if (!hasApiKey()) {
            throw new ConfigurationException("logai.llm.api-key is required for provider " + selection.provider());
        }
    }

    private boolean hasApiKey() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }
}
