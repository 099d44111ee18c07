package me.golemcore.logai.domain.component;

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

import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.ToolDefinition;
import me.golemcore.logai.domain.model.ToolKind;
import me.golemcore.logai.domain.model.ToolResult;
import me.golemcore.logai.domain.service.RetrievalScope;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a retrieval tool the LLM can invoke. Tools expose
 * their JSON Schema definition to the LLM via function calling, turn the
 * model's arguments into a {@link RetrievalRequest}, and execute it.
 *
 * <p>
 * Parsing and execution are separate so the orchestrator can re-dispatch an
 * expanded request without going through the model again.
 */
public interface ToolComponent {

    ToolKind getKind();

    /**
     * Returns the tool definition with JSON Schema for function calling.
     */
    ToolDefinition getDefinition();

    /**
     * Parses the model's arguments.
     *
     * @throws me.golemcore.logai.domain.exception.InvalidParametersException
     *             with a message the model can act on
     */
    RetrievalRequest parseRequest(Map<String, Object> arguments);

    /**
     * Renders a request back into tool arguments, used when an automatic retry
     * is recorded in the conversation.
     */
    Map<String, Object> toArguments(RetrievalRequest request);

    /**
     * Executes the request. Store failures complete normally with a failed
     * {@link ToolResult}; only cancellation completes the future exceptionally.
     */
    CompletableFuture<ToolResult> execute(RetrievalRequest request, RetrievalScope scope);

    default String getToolName() {
        return getKind().getToolName();
    }
}
