package me.golemcore.logai.security;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Removes credentials and personal data from log text before it is shown to
 * the model.
 *
 * <p>
 * Rules run in a fixed order, most specific first, so that a PEM block or a
 * token is replaced as a whole before the generic digit and address patterns
 * see its contents. Placeholders contain no digits, {@code @}, dots or hex
 * runs, so no rule matches the output of another and
 * {@code sanitize(sanitize(x)).equals(sanitize(x))}.
 *
 * <p>
 * Only data destined for the model passes through here; the result cache keeps
 * raw payloads.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LogRedactor {

    public static final List<RedactionRule> DEFAULT_RULES = List.of(
            RedactionRule.of("private_key", "Private key",
                    "-----BEGIN (?:[A-Z0-9]+ )*PRIVATE KEY-----[\\s\\S]*?(?:-----END (?:[A-Z0-9]+ )*PRIVATE KEY-----|\\z)",
                    "[PRIVATE_KEY_REDACTED]"),
            RedactionRule.of("bearer_token", "Bearer token",
                    "(?i)\\bbearer\\s+[A-Za-z0-9\\-._~+/]{16,}=*",
                    "Bearer [TOKEN_REDACTED]"),
            RedactionRule.of("jwt", "JWT",
                    "\\beyJ[A-Za-z0-9_-]{5,}\\.eyJ[A-Za-z0-9_-]{5,}\\.[A-Za-z0-9_-]*",
                    "[JWT_REDACTED]"),
            RedactionRule.of("aws_access_key", "AWS access key",
                    "\\b(?:AKIA|ASIA)[0-9A-Z]{16}\\b",
                    "[AWS_KEY_REDACTED]"),
            RedactionRule.of("aws_secret_key", "AWS secret key",
                    "(?i)aws.{0,20}secret.{0,20}['\"][0-9a-zA-Z/+=]{40}['\"]",
                    "[AWS_CREDENTIAL_REDACTED]"),
            RedactionRule.of("api_key", "API key",
                    "(?i)(api[_\\s-]?key|apikey|api[_\\s-]?secret)[:\\s=\"']*[\"']?([a-zA-Z0-9_-]{20,})[\"']?",
                    "$1 [API_KEY_REDACTED]"),
            RedactionRule.of("url_password", "URL password",
                    "://[^:/\\s@]+:[^@\\s]+@",
                    "://[user]:[PASSWORD_REDACTED]@"),
            RedactionRule.of("email", "Email",
                    "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}",
                    "[EMAIL_REDACTED]"),
            RedactionRule.of("ipv4", "IPv4",
                    "\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b",
                    "[IP_REDACTED]"),
            RedactionRule.of("ipv6", "IPv6",
                    "\\b(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}\\b",
                    "[IP_REDACTED]"),
            RedactionRule.of("credit_card", "Credit card",
                    "\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b",
                    "[CC_REDACTED]"),
            RedactionRule.of("ssn", "SSN",
                    "\\b\\d{3}-\\d{2}-\\d{4}\\b",
                    "[SSN_REDACTED]"),
            RedactionRule.of("phone", "Phone",
                    "(?:\\(\\d{3}\\)\\s?|\\b\\d{3}[-.]?)\\d{3}[-.]?\\d{4}\\b",
                    "[PHONE_REDACTED]"));

    private final List<RedactionRule> rules;
    private final boolean enabled;

    @Autowired
    public LogRedactor(LogAiProperties properties) {
        this(DEFAULT_RULES, properties.getRedaction().isEnabled());
    }

    public LogRedactor(List<RedactionRule> rules, boolean enabled) {
        this.rules = List.copyOf(rules);
        this.enabled = enabled;
        if (!enabled) {
            log.warn("[Redaction] Redaction is disabled, log data reaches the model unfiltered");
        }
    }

    /**
     * Sanitizes text. Total: {@code null} becomes an empty string.
     */
    public String sanitize(String text) {
        return sanitizeWithStats(text).text();
    }

    /**
     * Sanitizes text and reports how many matches each rule replaced.
     */
    public RedactionResult sanitizeWithStats(String text) {
        if (text == null) {
            return new RedactionResult("", Map.of());
        }
        if (!enabled || text.isEmpty()) {
            return new RedactionResult(text, Map.of());
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        String current = text;
        for (RedactionRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(current);
            if (!matcher.find()) {
                continue;
            }
            StringBuilder sb = new StringBuilder(current.length());
            int matches = 0;
            do {
                matches++;
                matcher.appendReplacement(sb, rule.replacement());
            } while (matcher.find());
            matcher.appendTail(sb);
            current = sb.toString();
            counts.merge(rule.name(), matches, Integer::sum);
        }
        return new RedactionResult(current, Collections.unmodifiableMap(counts));
    }

    /**
     * Returns a copy of the payload with every event message sanitized. Group
     * metadata is passed through unchanged.
     */
    public RedactedPayload sanitizePayload(CachedPayload payload) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<LogEvent> events = new ArrayList<>(payload.getEvents().size());
        for (LogEvent event : payload.getEvents()) {
            RedactionResult result = sanitizeWithStats(event.getMessage());
            result.counts().forEach((rule, n) -> counts.merge(rule, n, Integer::sum));
            events.add(event.toBuilder().message(result.text()).build());
        }
        CachedPayload copy = CachedPayload.builder()
                .groups(new ArrayList<>(payload.getGroups()))
                .events(events)
                .truncated(payload.isTruncated())
                .build();
        if (!counts.isEmpty()) {
            log.debug("[Redaction] Redacted {} matches in {} events", counts.values().stream()
                    .mapToInt(Integer::intValue).sum(), events.size());
        }
        return new RedactedPayload(copy, Collections.unmodifiableMap(counts));
    }

    /**
     * Human readable summary, e.g. {@code "Redacted: 2 Email, 1 IPv4"}.
     */
    public String summarize(Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) {
            return "No sensitive data redacted";
        }
        List<String> parts = new ArrayList<>();
        for (RedactionRule rule : rules) {
            Integer n = counts.get(rule.name());
            if (n != null && n > 0) {
                parts.add(n + " " + rule.label());
            }
        }
        return "Redacted: " + String.join(", ", parts);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sanitized payload together with per-rule match counts.
     */
    public record RedactedPayload(CachedPayload payload, Map<String, Integer> counts) {
    }
}
