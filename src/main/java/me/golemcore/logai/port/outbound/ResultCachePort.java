package me.golemcore.logai.port.outbound;

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

import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.RetrievalRequest;

import java.util.Optional;

/**
 * Local store of raw retrieval results keyed by request signature. Never
 * performs network I/O.
 */
public interface ResultCachePort {

    /**
     * Returns the payload stored for an equivalent request, if present and not
     * expired. Updates the entry's access time.
     */
    Optional<CachedPayload> lookup(RetrievalRequest request);

    /**
     * Reads like {@link #lookup} but leaves the cache untouched: no access time
     * update, no expiry removal, no hit or miss counted. Pair with
     * {@link #recordAccess} once the read should take effect.
     */
    Optional<CachedPayload> peek(RetrievalRequest request);

    /**
     * Applies the side effects of an earlier {@link #peek}: counts the hit or
     * miss, refreshes the access time of a hit and drops an expired entry on a
     * miss.
     */
    void recordAccess(RetrievalRequest request, boolean hit);

    /**
     * Stores or overwrites the payload for the request, evicting least recently
     * used entries when over capacity.
     */
    void store(RetrievalRequest request, CachedPayload payload);

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int evictExpired();

    CacheStats stats();

    void clear();
}
