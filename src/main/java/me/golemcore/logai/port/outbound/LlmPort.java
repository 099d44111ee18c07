package me.golemcore.logai.port.outbound;

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

import me.golemcore.logai.domain.model.LlmChunk;
import me.golemcore.logai.domain.model.LlmRequest;
import me.golemcore.logai.domain.model.LlmResponse;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for integrating with LLM providers (OpenAI, Anthropic, Ollama). Provides
 * chat completion with function calling support and streaming.
 *
 * <p>
 * Implementations fail with
 * {@link me.golemcore.logai.domain.exception.ProviderUnavailableException} when
 * the provider cannot serve the request and with
 * {@link me.golemcore.logai.domain.exception.InvalidRequestException} when it
 * rejects the request.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming chat request. Text fragments are emitted as they
     * arrive; the last chunk is marked done and carries any tool calls.
     * After cancellation no further chunk is emitted.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    /**
     * Returns the model identifier used by this port.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
