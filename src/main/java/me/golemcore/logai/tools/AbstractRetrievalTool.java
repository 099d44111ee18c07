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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.component.ToolComponent;
import me.golemcore.logai.domain.exception.InvalidParametersException;
import me.golemcore.logai.domain.exception.LogAiException;
import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.domain.model.PartialFailure;
import me.golemcore.logai.domain.model.RetrievalOutcome;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.TimeWindow;
import me.golemcore.logai.domain.model.ToolFailureKind;
import me.golemcore.logai.domain.model.ToolResult;
import me.golemcore.logai.domain.service.LogRetrievalService;
import me.golemcore.logai.domain.service.RetrievalScope;
import me.golemcore.logai.domain.service.TimeExpressions;
import me.golemcore.logai.security.LogRedactor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Shared argument parsing and result rendering of the retrieval tools.
 */
@Slf4j
abstract class AbstractRetrievalTool implements ToolComponent {

    protected static final String PARAM_START_TIME = "start_time";
    protected static final String PARAM_END_TIME = "end_time";
    protected static final String PARAM_LIMIT = "limit";
    protected static final String TYPE = "type";
    protected static final String DESCRIPTION = "description";

    private final LogRetrievalService retrievalService;
    private final LogRedactor redactor;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    protected final Clock clock;

    protected AbstractRetrievalTool(LogRetrievalService retrievalService, LogRedactor redactor,
            ObjectMapper objectMapper, Executor executor, Clock clock) {
        this.retrievalService = retrievalService;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ToolResult> execute(RetrievalRequest request, RetrievalScope scope) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                RetrievalOutcome outcome = retrievalService.retrieve(request, scope);
                return toResult(outcome);
            } catch (CancellationException e) {
                throw e;
            } catch (LogAiException e) {
                log.debug("[Retrieval] {} failed ({}): {}", getToolName(), e.getFailureKind(), e.getMessage());
                return failure(e.getFailureKind(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Retrieval] {} failed unexpectedly", getToolName(), e);
                return failure(ToolFailureKind.EXECUTION_FAILED, getToolName() + " failed: " + e.getMessage());
            }
        }, executor);
    }

    /**
     * Renders the outcome for the model.
     */
    protected abstract Map<String, Object> render(RetrievalOutcome outcome);

    /**
     * One-line summary shown in tool call status updates.
     */
    protected abstract String summarize(RetrievalOutcome outcome);

    private ToolResult toResult(RetrievalOutcome outcome) {
        Map<String, Object> body = render(outcome);
        body.put("count", outcome.itemCount());
        body.put("truncated", outcome.isTruncated());
        if (outcome.isTruncated()) {
            body.put("note", "More results exist than the limit allows. Narrow the time window or the filter "
                    + "instead of repeating the same call.");
        }
        if (!outcome.getPartialFailures().isEmpty()) {
            List<Map<String, Object>> failures = new ArrayList<>();
            for (PartialFailure failure : outcome.getPartialFailures()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("scope", failure.scope());
                item.put("error_kind", failure.kind().name());
                item.put("error", failure.message());
                failures.add(item);
            }
            body.put("partial_failures", failures);
        }
        body.put("redaction", redactor.summarize(outcome.getRedactions()));

        return ToolResult.builder()
                .success(true)
                .output(toJson(body))
                .summary(summarize(outcome))
                .data(outcome.getPayload())
                .itemCount(outcome.itemCount())
                .truncated(outcome.isTruncated())
                .fromCache(outcome.isFromCache())
                .partialFailures(outcome.getPartialFailures())
                .redactions(outcome.getRedactions())
                .build();
    }

    private ToolResult failure(ToolFailureKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("error_kind", kind.name());
        ToolResult result = ToolResult.failure(kind, message);
        result.setOutput(toJson(body));
        return result;
    }

    protected String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new LogAiException("Failed to serialize tool result", e);
        }
    }

    // ==================== rendering helpers ====================

    protected static List<Map<String, Object>> renderEvents(List<LogEvent> events) {
        List<Map<String, Object>> rendered = new ArrayList<>(events.size());
        for (LogEvent event : events) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("timestamp", Instant.ofEpochMilli(event.getTimestamp()).toString());
            item.put("log_group", event.getLogGroup());
            item.put("log_stream", event.getLogStream());
            item.put("message", event.getMessage());
            rendered.add(item);
        }
        return rendered;
    }

    protected static Map<String, Object> renderWindow(TimeWindow window) {
        Map<String, Object> range = new LinkedHashMap<>();
        range.put("start", window.start().toString());
        range.put("end", window.end().toString());
        return range;
    }

    // ==================== argument parsing ====================

    protected static String optionalString(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    protected static String requiredString(Map<String, Object> arguments, String name) {
        String value = optionalString(arguments, name);
        if (value == null) {
            throw new InvalidParametersException("Missing required parameter '" + name + "'");
        }
        return value;
    }

    protected static int limit(Map<String, Object> arguments, int defaultValue, int maxValue) {
        Object value = arguments.get(PARAM_LIMIT);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else {
            try {
                parsed = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidParametersException("Parameter 'limit' must be an integer, got '" + value + "'", e);
            }
        }
        if (parsed < 1) {
            throw new InvalidParametersException("Parameter 'limit' must be at least 1");
        }
        return Math.min(parsed, maxValue);
    }

    protected TimeWindow window(Map<String, Object> arguments) {
        Instant start = TimeExpressions.parse(requiredString(arguments, PARAM_START_TIME), clock);
        String endExpression = optionalString(arguments, PARAM_END_TIME);
        Instant end = endExpression != null ? TimeExpressions.parse(endExpression, clock) : clock.instant();
        if (end.isBefore(start)) {
            throw new InvalidParametersException("end_time " + end + " is before start_time " + start);
        }
        return TimeWindow.of(start, end);
    }

    protected static void putWindow(Map<String, Object> arguments, TimeWindow window) {
        arguments.put(PARAM_START_TIME, window.start().toString());
        arguments.put(PARAM_END_TIME, window.end().toString());
    }

    protected static Map<String, Object> property(String type, String description) {
        return Map.of(TYPE, type, DESCRIPTION, description);
    }
}
