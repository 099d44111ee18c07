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
import me.golemcore.logai.domain.exception.InvalidParametersException;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Tool for searching events across every log group matching one or more name
 * prefixes. Each prefix is searched independently; prefixes that fail are
 * reported alongside the events of the others.
 */
@Component
public class SearchLogsTool extends AbstractRetrievalTool {

    private static final String PARAM_LOG_GROUP_PATTERNS = "log_group_patterns";
    private static final String PARAM_SEARCH_PATTERN = "search_pattern";

    private final LogAiProperties.ToolsProperties settings;

    public SearchLogsTool(LogRetrievalService retrievalService, LogRedactor redactor, ObjectMapper objectMapper,
            @Qualifier("toolExecutor") Executor executor, Clock clock, LogAiProperties properties) {
        super(retrievalService, redactor, objectMapper, executor, clock);
        this.settings = properties.getTools();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SEARCH_LOGS;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Search log events across all log groups whose names start with any of the given "
                        + "prefixes. Use when the exact log group is unknown.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_LOG_GROUP_PATTERNS, Map.of(
                                        TYPE, "array",
                                        DESCRIPTION, "Log group name prefixes, e.g. ['/aws/lambda/orders']",
                                        "items", Map.of(TYPE, "string")),
                                PARAM_SEARCH_PATTERN, property("string", "CloudWatch filter pattern to match"),
                                PARAM_START_TIME, property("string",
                                        "Start time: ISO-8601, epoch millis, 'yesterday' or relative like '1h ago'"),
                                PARAM_END_TIME, property("string", "End time in the same formats. Defaults to now"),
                                PARAM_LIMIT, property("integer", "Maximum number of events (default "
                                        + settings.getMaxItemsPerCall() + ", max " + settings.getMaxItemsLimit()
                                        + ")")),
                        "required", List.of(PARAM_LOG_GROUP_PATTERNS, PARAM_START_TIME)))
                .build();
    }

    @Override
    public RetrievalRequest parseRequest(Map<String, Object> arguments) {
        return RetrievalRequest.builder()
                .kind(getKind().getOperation())
                .scopes(patterns(arguments.get(PARAM_LOG_GROUP_PATTERNS)))
                .window(window(arguments))
                .filterPattern(optionalString(arguments, PARAM_SEARCH_PATTERN))
                .limit(limit(arguments, settings.getMaxItemsPerCall(), settings.getMaxItemsLimit()))
                .build();
    }

    @Override
    public Map<String, Object> toArguments(RetrievalRequest request) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(PARAM_LOG_GROUP_PATTERNS, request.scopesOrEmpty());
        if (request.getFilterPattern() != null) {
            arguments.put(PARAM_SEARCH_PATTERN, request.getFilterPattern());
        }
        putWindow(arguments, request.getWindow());
        arguments.put(PARAM_LIMIT, request.getLimit());
        return arguments;
    }

    @Override
    protected Map<String, Object> render(RetrievalOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("log_group_patterns", outcome.getRequest().scopesOrEmpty());
        body.put("time_range", renderWindow(outcome.getRequest().getWindow()));
        body.put("events", renderEvents(outcome.getPayload().getEvents()));
        return body;
    }

    @Override
    protected String summarize(RetrievalOutcome outcome) {
        String summary = outcome.itemCount() + " events across " + outcome.getRequest().scopesOrEmpty().size()
                + " prefixes";
        if (!outcome.getPartialFailures().isEmpty()) {
            summary += ", " + outcome.getPartialFailures().size() + " failed";
        }
        return summary + (outcome.isTruncated() ? " (truncated)" : "");
    }

    private static List<String> patterns(Object value) {
        List<String> patterns = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    patterns.add(item.toString().trim());
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    patterns.add(part.trim());
                }
            }
        }
        if (patterns.isEmpty()) {
            throw new InvalidParametersException("Missing required parameter 'log_group_patterns': "
                    + "provide at least one log group name prefix");
        }
        return patterns;
    }
}
