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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.RetrievalRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Lifetime of the retrievals issued by one orchestrator step.
 *
 * <p>
 * Tracks in-flight futures so the whole step can be cancelled at once, and
 * collects cache writes and cache reads so their effects become visible only
 * when the step completes. After {@link #cancel()} nothing is staged or
 * committed.
 */
@Slf4j
public class RetrievalScope {

    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final Queue<StagedWrite> stagedWrites = new ConcurrentLinkedQueue<>();
    private final Queue<StagedAccess> stagedAccesses = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    /**
     * Tracks a future of this step. A future registered after cancellation is
     * cancelled immediately.
     */
    public <T> CompletableFuture<T> register(CompletableFuture<T> future) {
        inFlight.add(future);
        future.whenComplete((result, error) -> inFlight.remove(future));
        if (cancelled) {
            future.cancel(true);
        }
        return future;
    }

    public void stage(RetrievalRequest request, CachedPayload payload) {
        if (!cancelled) {
            stagedWrites.add(new StagedWrite(request, payload));
        }
    }

    /**
     * Records a cache read whose access time and hit or miss count are applied
     * on commit.
     */
    public void stageAccess(RetrievalRequest request, boolean hit) {
        if (!cancelled) {
            stagedAccesses.add(new StagedAccess(request, hit));
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Retrieval cancelled");
        }
    }

    /**
     * Cancels every tracked future and discards staged writes.
     */
    public void cancel() {
        synchronized (this) {
            cancelled = true;
            stagedWrites.clear();
            stagedAccesses.clear();
        }
        List<CompletableFuture<?>> futures = new ArrayList<>(inFlight);
        futures.forEach(future -> future.cancel(true));
        log.debug("[Retrieval] Scope cancelled, {} futures aborted", futures.size());
    }

    /**
     * Hands staged reads, then staged writes, to their sinks unless the scope
     * was cancelled.
     *
     * @return {@code false} if the scope was cancelled and nothing was committed
     */
    public synchronized boolean commit(Consumer<StagedAccess> accessSink, Consumer<StagedWrite> writeSink) {
        if (cancelled) {
            return false;
        }
        StagedAccess access;
        while ((access = stagedAccesses.poll()) != null) {
            accessSink.accept(access);
        }
        StagedWrite write;
        while ((write = stagedWrites.poll()) != null) {
            writeSink.accept(write);
        }
        return true;
    }

    public int stagedCount() {
        return stagedWrites.size();
    }

    /**
     * A cache read whose side effects wait for the step to complete.
     */
    public record StagedAccess(RetrievalRequest request, boolean hit) {
    }

    /**
     * A raw payload waiting to be written to the cache.
     */
    public record StagedWrite(RetrievalRequest request, CachedPayload payload) {
    }
}
