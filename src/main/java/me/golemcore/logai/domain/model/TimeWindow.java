package me.golemcore.logai.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Absolute time window of a retrieval. Both bounds are inclusive on the remote
 * side; {@code end} is never before {@code start}.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Returns a window with the same end whose duration is this window's duration
     * multiplied by {@code factor}, extended backwards in time.
     */
    public TimeWindow expandBackward(double factor) {
        long millis = duration().toMillis();
        long expanded = (long) Math.ceil(millis * factor);
        return new TimeWindow(end.minusMillis(expanded), end);
    }

    public TimeWindow truncatedToSeconds() {
        return new TimeWindow(start.truncatedTo(ChronoUnit.SECONDS), end.truncatedTo(ChronoUnit.SECONDS));
    }

    public long startMillis() {
        return start.toEpochMilli();
    }

    public long endMillis() {
        return end.toEpochMilli();
    }
}
