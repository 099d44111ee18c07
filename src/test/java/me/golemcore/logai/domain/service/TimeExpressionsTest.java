package me.golemcore.logai.domain.service;

import me.golemcore.logai.domain.exception.InvalidParametersException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeExpressionsTest {

    private static final Instant NOW = Instant.parse("2026-02-14T10:30:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));

    @Test
    void shouldParseNow() {
        assertEquals(NOW, TimeExpressions.parse("now", clock));
        assertEquals(NOW, TimeExpressions.parse(" NOW ", clock));
    }

    @Test
    void shouldParseYesterdayAsStartOfPreviousUtcDay() {
        assertEquals(Instant.parse("2026-02-13T00:00:00Z"), TimeExpressions.parse("yesterday", clock));
    }

    @Test
    void shouldParseRelativeExpressions() {
        assertEquals(NOW.minusSeconds(3600), TimeExpressions.parse("1h ago", clock));
        assertEquals(NOW.minusSeconds(30 * 60), TimeExpressions.parse("30 minutes ago", clock));
        assertEquals(NOW.minusSeconds(2 * 86_400), TimeExpressions.parse("2 days ago", clock));
        assertEquals(NOW.minusSeconds(7 * 86_400), TimeExpressions.parse("1w ago", clock));
        assertEquals(NOW.minusSeconds(45), TimeExpressions.parse("45s ago", clock));
    }

    @Test
    void shouldParseEpochSecondsAndMillis() {
        assertEquals(Instant.ofEpochSecond(1_771_000_000L), TimeExpressions.parse("1771000000", clock));
        assertEquals(Instant.ofEpochMilli(1_771_000_000_123L), TimeExpressions.parse("1771000000123", clock));
    }

    @Test
    void shouldParseIsoForms() {
        assertEquals(Instant.parse("2026-02-14T08:00:00Z"), TimeExpressions.parse("2026-02-14T08:00:00Z", clock));
        assertEquals(Instant.parse("2026-02-14T06:00:00Z"),
                TimeExpressions.parse("2026-02-14T08:00:00+02:00", clock));
        assertEquals(Instant.parse("2026-02-14T08:00:00Z"), TimeExpressions.parse("2026-02-14T08:00:00", clock));
        assertEquals(Instant.parse("2026-02-14T00:00:00Z"), TimeExpressions.parse("2026-02-14", clock));
    }

    @Test
    void shouldRejectUnknownExpressionWithGuidance() {
        InvalidParametersException error = assertThrows(InvalidParametersException.class,
                () -> TimeExpressions.parse("last tuesday", clock));

        assertTrue(error.getMessage().contains("ISO-8601"));
    }

    @Test
    void shouldRejectEmptyExpression() {
        assertThrows(InvalidParametersException.class, () -> TimeExpressions.parse("  ", clock));
        assertThrows(InvalidParametersException.class, () -> TimeExpressions.parse(null, clock));
    }
}
