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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result of tool execution. {@code output} is the JSON document sent back to
 * the model as the tool message; {@code data} carries the redacted items for
 * callers inside the process.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private String summary; // one line, no retrieved data
    private CachedPayload data;
    private String error;
    private ToolFailureKind failureKind;

    private int itemCount;
    private boolean truncated;
    private boolean fromCache;

    @Builder.Default
    private List<PartialFailure> partialFailures = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> redactions = Map.of();

    /**
     * Creates a failed tool result with a classified error.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    /**
     * A successful call that produced no items. Failures are never empty.
     */
    public boolean isEmpty() {
        return success && itemCount == 0;
    }

    public boolean hasPartialFailures() {
        return partialFailures != null && !partialFailures.isEmpty();
    }
}
