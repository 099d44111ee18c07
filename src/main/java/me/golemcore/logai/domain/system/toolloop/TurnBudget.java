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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-turn counters shared by concurrent tool calls: total dispatches against
 * the iteration cap and automatic retries per request signature.
 */
class TurnBudget {

    private final int maxDispatches;
    private final AtomicInteger dispatches = new AtomicInteger();
    private final AtomicInteger llmCalls = new AtomicInteger();
    private final Map<String, Integer> retries = new ConcurrentHashMap<>();

    TurnBudget(int maxDispatches) {
        this.maxDispatches = maxDispatches;
    }

    /**
     * Reserves one dispatch.
     *
     * @return {@code false} once the cap is reached
     */
    boolean tryReserveDispatch() {
        while (true) {
            int current = dispatches.get();
            if (current >= maxDispatches) {
                return false;
            }
            if (dispatches.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Reserves the next automatic retry of a signature.
     *
     * @return the attempt number starting at 1, or 0 once {@code maxAttempts}
     *         retries were reserved
     */
    int tryReserveRetry(String signature, int maxAttempts) {
        int[] reserved = new int[1];
        retries.compute(signature, (key, made) -> {
            int current = made != null ? made : 0;
            if (current >= maxAttempts) {
                return made;
            }
            reserved[0] = current + 1;
            return reserved[0];
        });
        return reserved[0];
    }

    int retriesFor(String signature) {
        return retries.getOrDefault(signature, 0);
    }

    void recordLlmCall() {
        llmCalls.incrementAndGet();
    }

    int llmCalls() {
        return llmCalls.get();
    }

    int dispatches() {
        return dispatches.get();
    }

    int maxDispatches() {
        return maxDispatches;
    }
}
