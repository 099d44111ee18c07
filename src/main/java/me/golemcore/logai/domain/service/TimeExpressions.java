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

import me.golemcore.logai.domain.exception.InvalidParametersException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the time expressions the model passes in tool arguments.
 *
 * <p>
 * Accepted forms:
 * <ul>
 * <li>{@code now}, {@code yesterday} (start of the previous UTC day)</li>
 * <li>relative: {@code 15m ago}, {@code 2 hours ago}, {@code 1d ago},
 * {@code 1w ago}</li>
 * <li>ISO-8601 instant or offset date-time; local date-times and dates are read
 * as UTC</li>
 * <li>epoch milliseconds (10 digits or fewer are read as epoch seconds)</li>
 * </ul>
 */
public final class TimeExpressions {

    private static final Pattern RELATIVE = Pattern.compile(
            "^(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours"
                    + "|d|day|days|w|wk|wks|week|weeks)\\s+ago$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final int EPOCH_SECONDS_MAX_DIGITS = 10;
    private static final List<Function<String, Instant>> ISO_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());

    private TimeExpressions() {
    }

    /**
     * Resolves an expression to an absolute instant relative to the clock.
     *
     * @throws InvalidParametersException
     *             if the expression matches none of the accepted forms
     */
    public static Instant parse(String expression, Clock clock) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidParametersException("Time expression is empty");
        }
        String value = expression.trim().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        if ("now".equals(value)) {
            return now;
        }
        if ("yesterday".equals(value)) {
            return LocalDate.ofInstant(now, ZoneOffset.UTC).minusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }

        Matcher relative = RELATIVE.matcher(value);
        if (relative.matches()) {
            long amount = Long.parseLong(relative.group(1));
            return now.minus(unitDuration(relative.group(2)).multipliedBy(amount));
        }

        if (DIGITS.matcher(value).matches()) {
            long epoch = Long.parseLong(value);
            return value.length() <= EPOCH_SECONDS_MAX_DIGITS ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch);
        }

        return parseIso(expression.trim());
    }

    private static Duration unitDuration(String unit) {
        return switch (unit.charAt(0)) {
        case 's' -> Duration.ofSeconds(1);
        case 'm' -> Duration.ofMinutes(1);
        case 'h' -> Duration.ofHours(1);
        case 'd' -> Duration.ofDays(1);
        default -> Duration.ofDays(7);
        };
    }

    private static Instant parseIso(String value) {
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : ISO_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new InvalidParametersException("Unrecognized time expression '" + value
                + "'. Use ISO-8601 (2024-01-15T10:00:00Z), epoch milliseconds, 'now', 'yesterday' or "
                + "a relative form like '1h ago'", last);
    }
}
