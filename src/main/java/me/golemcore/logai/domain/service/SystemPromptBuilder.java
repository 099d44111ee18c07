package me.golemcore.logai.domain.service;

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

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds the system prompt for every model call: role, tool usage guidance,
 * the log group catalog and the current time.
 */
@Component
public class SystemPromptBuilder {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    private static final String TEMPLATE = """
            You are an observability assistant that helps engineers investigate AWS CloudWatch logs.

            ## Tools
            - list_log_groups: discover log groups by name prefix
            - fetch_logs: read events from one log group in a time range
            - search_logs: read events across all groups matching name prefixes

            %s

            ## How to work
            - Start with a narrow time range that matches the question and widen it when nothing is found.
            - Use filter patterns to cut down volume when looking for a specific error.
            - Fetch data before analyzing it. Never invent log lines.
            - When a result is truncated, say so and narrow the window or the filter instead of repeating the call.
            - When a log group does not exist, look for similar names before asking the user.
            - Empty results over a bounded window are retried automatically with wider windows. The results of
              those retries appear in the conversation.

            ## Act, do not announce
            If you decide to look something up, call the tool in the same response. Do not reply with
            "I'll search..." or "Let me check..." without a tool call.

            ## Answers
            Be concise. Highlight errors, patterns and anomalies, quote relevant log lines in code blocks and
            suggest next steps. Sensitive values in log data appear as placeholders like [EMAIL_REDACTED].

            Current time: %s
            """;

    private final LogGroupCatalogService catalog;
    private final Clock clock;

    public SystemPromptBuilder(LogGroupCatalogService catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    public String build() {
        return TEMPLATE.formatted(catalog.formatForPrompt().strip(), TIME_FORMAT.format(clock.instant()));
    }
}
