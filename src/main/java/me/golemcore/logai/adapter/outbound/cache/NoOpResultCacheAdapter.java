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

package me.golemcore.logai.adapter.outbound.cache;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.port.outbound.ResultCachePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache used when {@code logai.cache.enabled=false}: every lookup misses and
 * nothing is stored.
 */
@Component
@ConditionalOnProperty(prefix = "logai.cache", name = "enabled", havingValue = "false")
@Slf4j
public class NoOpResultCacheAdapter implements ResultCachePort {

    private final AtomicLong misses = new AtomicLong();

    public NoOpResultCacheAdapter() {
        log.info("[Cache] Result cache disabled");
    }

    @Override
    public Optional<CachedPayload> lookup(RetrievalRequest request) {
        misses.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public Optional<CachedPayload> peek(RetrievalRequest request) {
        return Optional.empty();
    }

    @Override
    public void recordAccess(RetrievalRequest request, boolean hit) {
        if (!hit) {
            misses.incrementAndGet();
        }
    }

    @Override
    public void store(RetrievalRequest request, CachedPayload payload) {
        // disabled
    }

    @Override
    public int evictExpired() {
        return 0;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(0, 0, 0, 0, misses.get());
    }

    @Override
    public void clear() {
        // disabled
    }
}
