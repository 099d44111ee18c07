package me.golemcore.logai.domain.system.toolloop;

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

import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.ToolResult;
import me.golemcore.logai.infrastructure.config.LogAiProperties;

/**
 * Decides when an empty retrieval is re-dispatched with a wider window, and
 * computes that window.
 */
public class EmptyResultRetryPolicy {

    private final boolean enabled;
    private final int maxAttempts;
    private final double expansionFactor;

    public EmptyResultRetryPolicy(LogAiProperties.AgentProperties settings) {
        this(settings.isAutoRetryEnabled(), settings.getMaxRetryAttempts(), settings.getTimeExpansionFactor());
    }

    public EmptyResultRetryPolicy(boolean enabled, int maxAttempts, double expansionFactor) {
        this.enabled = enabled;
        this.maxAttempts = maxAttempts;
        this.expansionFactor = expansionFactor;
    }

    /**
     * Only successful, empty results over a bounded window qualify. Failures and
     * partial failures go back to the model as they are.
     */
    public boolean qualifies(RetrievalRequest request, ToolResult result) {
        return enabled
                && request.hasBoundedWindow()
                && result.isEmpty()
                && !result.hasPartialFailures();
    }

    /**
     * Same request with the window multiplied by the expansion factor, keeping
     * its end.
     */
    public RetrievalRequest expand(RetrievalRequest request) {
        return request.toBuilder()
                .window(request.getWindow().expandBackward(expansionFactor))
                .build();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public double expansionFactor() {
        return expansionFactor;
    }
}
