package me.golemcore.logai.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of one dispatched tool call. Each status transition
 * produces a new snapshot with the same {@code id}; a {@code FAILED} snapshot
 * always carries a {@code failureCause}.
 */
@Value
@Builder(toBuilder = true)
public class ToolCallRecord {

    String id;
    String sourceToolCallId; // model tool call this record derives from
    String toolName;
    ToolKind kind; // null when the model named an unknown tool
    Map<String, Object> parameters;
    ToolCallStatus status;
    String resultSummary;
    String failureCause;
    int retryAttempt;
    Instant startedAt;
    Instant completedAt;

    public ToolCallRecord running(Instant now) {
        return toBuilder().status(ToolCallStatus.RUNNING).startedAt(now).build();
    }

    public ToolCallRecord succeeded(String summary, Instant now) {
        return toBuilder().status(ToolCallStatus.SUCCEEDED).resultSummary(summary).completedAt(now).build();
    }

    public ToolCallRecord failed(String cause, Instant now) {
        String effectiveCause = cause == null || cause.isBlank() ? "Unknown failure" : cause;
        return toBuilder().status(ToolCallStatus.FAILED).failureCause(effectiveCause).completedAt(now).build();
    }

    public boolean isRetry() {
        return retryAttempt > 0;
    }

    public Duration elapsed() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
