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
import me.golemcore.logai.domain.model.LogGroup;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Tool for discovering log groups by name prefix.
 */
@Component
public class ListLogGroupsTool extends AbstractRetrievalTool {

    private static final String PARAM_PREFIX = "prefix";

    private final LogAiProperties.ToolsProperties settings;

    public ListLogGroupsTool(LogRetrievalService retrievalService, LogRedactor redactor, ObjectMapper objectMapper,
            @Qualifier("toolExecutor") Executor executor, Clock clock, LogAiProperties properties) {
        super(retrievalService, redactor, objectMapper, executor, clock);
        this.settings = properties.getTools();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.LIST_LOG_GROUPS;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("List available log groups. Use a prefix such as '/aws/lambda/' to narrow the list.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_PREFIX, property("string", "Log group name prefix to filter by"),
                                PARAM_LIMIT, property("integer", "Maximum number of groups to return (default "
                                        + settings.getMaxLogGroups() + ", max " + settings.getMaxLogGroupsLimit()
                                        + ")")),
                        "required", List.of()))
                .build();
    }

    @Override
    public RetrievalRequest parseRequest(Map<String, Object> arguments) {
        return RetrievalRequest.builder()
                .kind(getKind().getOperation())
                .scope(optionalString(arguments, PARAM_PREFIX))
                .limit(limit(arguments, settings.getMaxLogGroups(), settings.getMaxLogGroupsLimit()))
                .build();
    }

    @Override
    public Map<String, Object> toArguments(RetrievalRequest request) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (request.getScope() != null) {
            arguments.put(PARAM_PREFIX, request.getScope());
        }
        arguments.put(PARAM_LIMIT, request.getLimit());
        return arguments;
    }

    @Override
    protected Map<String, Object> render(RetrievalOutcome outcome) {
        List<Map<String, Object>> groups = new ArrayList<>();
        for (LogGroup group : outcome.getPayload().getGroups()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", group.getName());
            if (group.getCreatedAt() != null) {
                item.put("created", Instant.ofEpochMilli(group.getCreatedAt()).toString());
            }
            item.put("stored_bytes", group.getStoredBytes());
            item.put("retention_days", group.getRetentionDays());
            groups.add(item);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("log_groups", groups);
        return body;
    }

    @Override
    protected String summarize(RetrievalOutcome outcome) {
        return outcome.itemCount() + " log groups" + (outcome.isTruncated() ? " (truncated)" : "");
    }
}
