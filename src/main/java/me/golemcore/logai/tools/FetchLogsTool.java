package me.golemcore.logai.tools;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.logai.domain.model.RetrievalOutcome;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.ToolDefinition;
import me.golemcore.logai.domain.model.ToolKind;
import me.golemcore.logai.domain.service.LogRetrievalService;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.security.LogRedactor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Tool for reading events from one log group within a time window.
 *
 * <p>
 * Time parameters accept ISO-8601, epoch milliseconds, {@code now},
 * {@code yesterday} and relative forms such as {@code 2h ago}. The end defaults
 * to now.
 */
@Component
public class FetchLogsTool extends AbstractRetrievalTool {

    private static final String PARAM_LOG_GROUP = "log_group";
    private static final String PARAM_FILTER_PATTERN = "filter_pattern";

    private final LogAiProperties.ToolsProperties settings;

    public FetchLogsTool(LogRetrievalService retrievalService, LogRedactor redactor, ObjectMapper objectMapper,
            @Qualifier("toolExecutor") Executor executor, Clock clock, LogAiProperties properties) {
        super(retrievalService, redactor, objectMapper, executor, clock);
        this.settings = properties.getTools();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.FETCH_LOGS;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Fetch log events from a single log group within a time range, optionally filtered. "
                        + "Results are newest first.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_LOG_GROUP, property("string", "Exact log group name"),
                                PARAM_START_TIME, property("string",
                                        "Start time: ISO-8601, epoch millis, 'yesterday' or relative like '1h ago'"),
                                PARAM_END_TIME, property("string", "End time in the same formats. Defaults to now"),
                                PARAM_FILTER_PATTERN, property("string",
                                        "CloudWatch filter pattern, e.g. 'ERROR' or '{ $.level = \"error\" }'"),
                                PARAM_LIMIT, property("integer", "Maximum number of events (default "
                                        + settings.getMaxItemsPerCall() + ", max " + settings.getMaxItemsLimit()
                                        + ")")),
                        "required", List.of(PARAM_LOG_GROUP, PARAM_START_TIME)))
                .build();
    }

    @Override
    public RetrievalRequest parseRequest(Map<String, Object> arguments) {
        return RetrievalRequest.builder()
                .kind(getKind().getOperation())
                .scope(requiredString(arguments, PARAM_LOG_GROUP))
                .window(window(arguments))
                .filterPattern(optionalString(arguments, PARAM_FILTER_PATTERN))
                .limit(limit(arguments, settings.getMaxItemsPerCall(), settings.getMaxItemsLimit()))
                .build();
    }

    @Override
    public Map<String, Object> toArguments(RetrievalRequest request) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(PARAM_LOG_GROUP, request.getScope());
        putWindow(arguments, request.getWindow());
        if (request.getFilterPattern() != null) {
            arguments.put(PARAM_FILTER_PATTERN, request.getFilterPattern());
        }
        arguments.put(PARAM_LIMIT, request.getLimit());
        return arguments;
    }

    @Override
    protected Map<String, Object> render(RetrievalOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("log_group", outcome.getRequest().getScope());
        body.put("time_range", renderWindow(outcome.getRequest().getWindow()));
        body.put("events", renderEvents(outcome.getPayload().getEvents()));
        return body;
    }

    @Override
    protected String summarize(RetrievalOutcome outcome) {
        return outcome.itemCount() + " events from " + outcome.getRequest().getScope()
                + (outcome.isTruncated() ? " (truncated)" : "");
    }
}
