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
import me.golemcore.logai.domain.exception.InvalidParametersException;
import me.golemcore.logai.domain.exception.LogAiException;
import me.golemcore.logai.domain.exception.RateLimitedException;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.domain.model.LogGroup;
import me.golemcore.logai.domain.model.PartialFailure;
import me.golemcore.logai.domain.model.RetrievalOutcome;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.ToolFailureKind;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LogStorePort;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.security.LogRedactor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Executes retrieval requests: result cache first, then the remote log store,
 * then the redactor.
 *
 * <p>
 * Remote results are staged in the caller's {@link RetrievalScope} instead of
 * being written to the cache directly. A search over several prefixes fans out
 * into one branch per prefix, each with its own cache entry, run concurrently
 * on the retrieval executor. Throttling by the store is retried here with
 * exponential backoff and never reaches the caller as an empty result.
 */
@Service
@Slf4j
public class LogRetrievalService {

    private static final Comparator<LogEvent> NEWEST_FIRST = Comparator.comparingLong(LogEvent::getTimestamp)
            .reversed();

    private final LogStorePort logStore;
    private final ResultCachePort cache;
    private final LogRedactor redactor;
    private final RequestCanonicalizer canonicalizer;
    private final LogAiProperties.RateLimitProperties rateLimit;
    private final Executor executor;

    public LogRetrievalService(LogStorePort logStore, ResultCachePort cache, LogRedactor redactor,
            RequestCanonicalizer canonicalizer, LogAiProperties properties,
            @Qualifier("retrievalExecutor") Executor executor) {
        this.logStore = logStore;
        this.cache = cache;
        this.redactor = redactor;
        this.canonicalizer = canonicalizer;
        this.rateLimit = properties.getTools().getRateLimit();
        this.executor = executor;
    }

    /**
     * Runs the request within the given step scope.
     *
     * @throws LogAiException
     *             subclasses for store failures; for a search only when every
     *             branch failed
     * @throws CancellationException
     *             if the scope was cancelled
     */
    public RetrievalOutcome retrieve(RetrievalRequest request, RetrievalScope scope) {
        scope.throwIfCancelled();
        return switch (request.getKind()) {
        case ENUMERATE -> single(request, scope, () -> listGroups(request));
        case FETCH -> single(request, scope, () -> fetchEvents(request));
        case SEARCH -> fanOut(request, scope);
        };
    }

    private RetrievalOutcome single(RetrievalRequest request, RetrievalScope scope, Supplier<CachedPayload> remote) {
        Loaded loaded = load(request, scope, remote);
        LogRedactor.RedactedPayload redacted = redactor.sanitizePayload(loaded.payload());
        return RetrievalOutcome.builder()
                .request(request)
                .payload(redacted.payload())
                .truncated(loaded.payload().isTruncated())
                .fromCache(loaded.fromCache())
                .redactions(redacted.counts())
                .build();
    }

    private RetrievalOutcome fanOut(RetrievalRequest request, RetrievalScope scope) {
        Map<String, RetrievalRequest> branches = new LinkedHashMap<>();
        for (String prefix : request.scopesOrEmpty()) {
            if (prefix == null || prefix.isBlank()) {
                continue;
            }
            RetrievalRequest branch = request.toBuilder().scopes(List.of(prefix.trim())).build();
            branches.putIfAbsent(canonicalizer.signature(branch), branch);
        }
        if (branches.isEmpty()) {
            throw new InvalidParametersException("search_logs needs at least one log group prefix");
        }

        List<RetrievalRequest> branchRequests = new ArrayList<>(branches.values());
        List<CompletableFuture<Loaded>> futures = new ArrayList<>(branchRequests.size());
        for (RetrievalRequest branch : branchRequests) {
            futures.add(scope.register(CompletableFuture.supplyAsync(
                    () -> load(branch, scope, () -> searchEvents(branch)), executor)));
        }

        List<Loaded> succeeded = new ArrayList<>();
        List<PartialFailure> failures = new ArrayList<>();
        LogAiException firstFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            String prefix = branchRequests.get(i).getScopes().get(0);
            try {
                succeeded.add(futures.get(i).join());
            } catch (CompletionException e) {
                LogAiException failure = unwrap(e);
                log.warn("[Retrieval] Search branch '{}' failed: {}", prefix, failure.getMessage());
                failures.add(new PartialFailure(prefix, failure.getFailureKind(), failure.getMessage()));
                if (firstFailure == null) {
                    firstFailure = failure;
                }
            }
        }
        scope.throwIfCancelled();
        if (succeeded.isEmpty()) {
            throw firstFailure;
        }

        Map<String, LogEvent> union = new LinkedHashMap<>();
        boolean truncated = false;
        boolean allCached = true;
        for (Loaded loaded : succeeded) {
            truncated |= loaded.payload().isTruncated();
            allCached &= loaded.fromCache();
            for (LogEvent event : loaded.payload().getEvents()) {
                union.putIfAbsent(eventKey(event), event);
            }
        }
        List<LogEvent> events = new ArrayList<>(union.values());
        events.sort(NEWEST_FIRST);
        if (events.size() > request.getLimit()) {
            truncated = true;
            events = new ArrayList<>(events.subList(0, request.getLimit()));
        }

        LogRedactor.RedactedPayload redacted = redactor.sanitizePayload(CachedPayload.ofEvents(events, truncated));
        return RetrievalOutcome.builder()
                .request(request)
                .payload(redacted.payload())
                .truncated(truncated)
                .fromCache(allCached)
                .partialFailures(List.copyOf(failures))
                .redactions(redacted.counts())
                .build();
    }

    private Loaded load(RetrievalRequest request, RetrievalScope scope, Supplier<CachedPayload> remote) {
        Optional<CachedPayload> cached = cache.peek(request);
        scope.stageAccess(request, cached.isPresent());
        if (cached.isPresent()) {
            log.debug("[Retrieval] Cache hit: {}", request.describe());
            return new Loaded(cached.get(), true);
        }
        scope.throwIfCancelled();
        log.debug("[Retrieval] Cache miss, calling log store: {}", request.describe());
        CachedPayload payload = withRateLimitBackoff(remote);
        scope.throwIfCancelled();
        scope.stage(request, payload);
        return new Loaded(payload, false);
    }

    private CachedPayload withRateLimitBackoff(Supplier<CachedPayload> remote) {
        return Mono.fromSupplier(remote)
                .retryWhen(Retry.backoff(Math.max(0, rateLimit.getMaxAttempts() - 1), rateLimit.getFirstBackoff())
                        .maxBackoff(rateLimit.getMaxBackoff())
                        .filter(RateLimitedException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("[Retrieval] Log store throttled, retry {}/{}",
                                signal.totalRetries() + 1, rateLimit.getMaxAttempts() - 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    private CachedPayload listGroups(RetrievalRequest request) {
        List<LogGroup> groups = logStore.listLogGroups(request.getScope(), request.getLimit() + 1);
        boolean truncated = groups.size() > request.getLimit();
        return CachedPayload.ofGroups(truncated ? groups.subList(0, request.getLimit()) : groups, truncated);
    }

    private CachedPayload fetchEvents(RetrievalRequest request) {
        List<LogEvent> events = logStore.fetchEvents(request.getScope(), request.getWindow(),
                request.getFilterPattern(), request.getLimit() + 1);
        return capEvents(events, request.getLimit());
    }

    private CachedPayload searchEvents(RetrievalRequest branch) {
        List<LogEvent> events = logStore.searchEvents(branch.getScopes(), branch.getWindow(),
                branch.getFilterPattern(), branch.getLimit() + 1);
        return capEvents(events, branch.getLimit());
    }

    private static CachedPayload capEvents(List<LogEvent> events, int limit) {
        List<LogEvent> sorted = new ArrayList<>(events);
        sorted.sort(NEWEST_FIRST);
        boolean truncated = sorted.size() > limit;
        return CachedPayload.ofEvents(truncated ? sorted.subList(0, limit) : sorted, truncated);
    }

    private static String eventKey(LogEvent event) {
        if (event.getEventId() != null) {
            return event.getLogGroup() + '\u0000' + event.getEventId();
        }
        return event.getLogGroup() + '\u0000' + event.getLogStream() + '\u0000' + event.getTimestamp() + '\u0000'
                + event.getMessage();
    }

    private static LogAiException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CancellationException cancellation) {
            throw cancellation;
        }
        if (cause instanceof LogAiException logAiException) {
            return logAiException;
        }
        return new LogAiException("Search branch failed: " + (cause != null ? cause.getMessage() : e.getMessage()),
                cause);
    }

    private record Loaded(CachedPayload payload, boolean fromCache) {
    }
}
