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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import me.golemcore.logai.domain.model.IntentType;
import me.golemcore.logai.domain.model.ToolLoopStats;

import java.util.Locale;

/**
 * Tool loop counters of one conversation, registered in the shared meter
 * registry under a {@code conversation} tag.
 */
public class ToolLoopMetrics {

    static final String RETRIES = "logai.toolloop.retries";
    static final String RETRIES_EXHAUSTED = "logai.toolloop.retries.exhausted";
    static final String NUDGES = "logai.toolloop.nudges";
    static final String CAP_HITS = "logai.toolloop.cap.hits";
    static final String MERGED_CALLS = "logai.toolloop.calls.merged";
    private static final String CONVERSATION_TAG = "conversation";

    private final MeterRegistry registry;
    private final String conversationId;
    private final Counter retries;
    private final Counter retriesExhausted;
    private final Counter capHits;
    private final Counter mergedCalls;

    public ToolLoopMetrics(MeterRegistry registry, String conversationId) {
        this.registry = registry;
        this.conversationId = conversationId;
        this.retries = counter(RETRIES, "Empty results re-dispatched with a wider window");
        this.retriesExhausted = counter(RETRIES_EXHAUSTED, "Tool calls still empty after the widest window");
        this.capHits = counter(CAP_HITS, "Turns stopped by the tool call limit");
        this.mergedCalls = counter(MERGED_CALLS, "Duplicate tool calls answered by an identical call");
    }

    void retry() {
        retries.increment();
    }

    void retriesExhausted() {
        retriesExhausted.increment();
    }

    void capHit() {
        capHits.increment();
    }

    void mergedCall() {
        mergedCalls.increment();
    }

    void nudge(IntentType type) {
        Counter.builder(NUDGES)
                .description("Corrective prompts after an announced but missing tool call")
                .tag(CONVERSATION_TAG, conversationId)
                .tag("intent_type", type.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public ToolLoopStats snapshot() {
        double nudges = registry.find(NUDGES)
                .tag(CONVERSATION_TAG, conversationId)
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
        return new ToolLoopStats((long) retries.count(), (long) retriesExhausted.count(), (long) nudges,
                (long) capHits.count(), (long) mergedCalls.count());
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
                .description(description)
                .tag(CONVERSATION_TAG, conversationId)
                .register(registry);
    }
}
