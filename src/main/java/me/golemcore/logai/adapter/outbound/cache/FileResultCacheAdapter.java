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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.CachedPayload;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.ResultCachePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Result cache persisted as one file per entry under
 * {@code logai.cache.directory}.
 *
 * <p>
 * The in-memory index mirrors the entry headers and is rebuilt from disk at
 * startup; the total size is maintained incrementally afterwards. Payload
 * files are read only on a hit. Operations on one key are serialized by a
 * striped lock; eviction takes a separate lock and never holds more than one
 * stripe at a time.
 *
 * <p>
 * Expiry is lazy: an entry older than the TTL is removed when it is looked up
 * or when {@link #evictExpired()} is called. Entries whose time window ended
 * more than {@code historical-age} ago describe data that can no longer change
 * and are exempt from expiry, but not from size eviction.
 */
@Component
@ConditionalOnProperty(prefix = "logai.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class FileResultCacheAdapter implements ResultCachePort {

    private static final int LOCK_STRIPES = 64;
    private static final int MAX_EVICTION_PASSES = 3;
    private static final Pattern SIGNATURE = Pattern.compile("^[0-9a-f]{64}$");

    private final LogAiProperties.CacheProperties settings;
    private final RequestCanonicalizer canonicalizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ConcurrentHashMap<String, IndexEntry> index = new ConcurrentHashMap<>();
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
    private final ReentrantLock evictionLock = new ReentrantLock();
    private final AtomicLong totalBytes = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private Path directory;

    public FileResultCacheAdapter(LogAiProperties properties, RequestCanonicalizer canonicalizer,
            ObjectMapper objectMapper, Clock clock) {
        this.settings = properties.getCache();
        this.canonicalizer = canonicalizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @PostConstruct
    public void init() {
        directory = Paths.get(settings.getDirectory().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory " + directory, e);
        }

        int corrupt = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(".tmp")) {
                    deleteQuietly(file);
                    continue;
                }
                if (!name.endsWith(CacheEntryFile.SUFFIX)) {
                    continue;
                }
                String key = name.substring(0, name.length() - CacheEntryFile.SUFFIX.length());
                try {
                    if (!SIGNATURE.matcher(key).matches()) {
                        throw new CacheEntryFile.CorruptEntryException("file name is not a signature");
                    }
                    CacheEntryFile.Header header = CacheEntryFile.readHeader(file);
                    index.put(key, new IndexEntry(header.createdAt(), header.lastAccessedAt(), header.windowEnd(),
                            header.payloadSize()));
                    totalBytes.addAndGet(header.payloadSize());
                } catch (IOException e) {
                    log.warn("[Cache] Deleting corrupt entry {}: {}", name, e.getMessage());
                    deleteQuietly(file);
                    corrupt++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read cache directory " + directory, e);
        }

        log.info("[Cache] Loaded {} entries ({} bytes, {} corrupt removed) from {}", index.size(), totalBytes.get(),
                corrupt, directory);
        enforceCapacity(null);
    }

    @Override
    public Optional<CachedPayload> lookup(RetrievalRequest request) {
        String key = canonicalizer.signature(request);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            if (entry == null) {
                misses.incrementAndGet();
                log.debug("[Cache] Miss {}", key);
                return Optional.empty();
            }
            long now = clock.millis();
            if (isExpired(entry, now)) {
                removeLocked(key, entry);
                misses.incrementAndGet();
                log.debug("[Cache] Expired {}", key);
                return Optional.empty();
            }

            CachedPayload payload;
            try {
                byte[] bytes = CacheEntryFile.readPayload(fileFor(key), entry.size());
                payload = objectMapper.readValue(bytes, CachedPayload.class);
            } catch (IOException e) {
                log.warn("[Cache] Dropping unreadable entry {}: {}", key, e.getMessage());
                removeLocked(key, entry);
                misses.incrementAndGet();
                return Optional.empty();
            }

            index.put(key, entry.accessedAt(now));
            touchQuietly(key, now);
            hits.incrementAndGet();
            log.debug("[Cache] Hit {} ({} bytes)", key, entry.size());
            return Optional.of(payload);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CachedPayload> peek(RetrievalRequest request) {
        String key = canonicalizer.signature(request);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            if (entry == null || isExpired(entry, clock.millis())) {
                return Optional.empty();
            }
            try {
                byte[] bytes = CacheEntryFile.readPayload(fileFor(key), entry.size());
                return Optional.of(objectMapper.readValue(bytes, CachedPayload.class));
            } catch (IOException e) {
                log.debug("[Cache] Unreadable entry {} on peek: {}", key, e.getMessage());
                return Optional.empty();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordAccess(RetrievalRequest request, boolean hit) {
        String key = canonicalizer.signature(request);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            IndexEntry entry = index.get(key);
            long now = clock.millis();
            if (!hit) {
                misses.incrementAndGet();
                if (entry != null && isExpired(entry, now)) {
                    removeLocked(key, entry);
                }
                return;
            }
            hits.incrementAndGet();
            if (entry != null) {
                index.put(key, entry.accessedAt(now));
                touchQuietly(key, now);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void store(RetrievalRequest request, CachedPayload payload) {
        String key = canonicalizer.signature(request);
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            log.warn("[Cache] Cannot serialize payload for {}: {}", key, e.getMessage());
            return;
        }
        if (bytes.length > settings.getCapacityBytes()) {
            log.warn("[Cache] Entry {} of {} bytes exceeds capacity of {} bytes, not stored", key, bytes.length,
                    settings.getCapacityBytes());
            return;
        }

        long now = clock.millis();
        long windowEnd = request.getWindow() != null ? request.getWindow().endMillis() : CacheEntryFile.NO_WINDOW;
        IndexEntry entry = new IndexEntry(now, now, windowEnd, bytes.length);

        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            CacheEntryFile.write(fileFor(key),
                    new CacheEntryFile.Header(entry.createdAt(), entry.lastAccessedAt(), entry.windowEnd(),
                            entry.size()),
                    bytes);
            IndexEntry previous = index.put(key, entry);
            totalBytes.addAndGet(entry.size() - (previous != null ? previous.size() : 0));
            log.debug("[Cache] Stored {} ({} bytes)", key, bytes.length);
        } catch (IOException e) {
            log.warn("[Cache] Failed to write entry {}: {}", key, e.getMessage());
            return;
        } finally {
            lock.unlock();
        }

        enforceCapacity(key);
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        int removed = 0;
        for (String key : new ArrayList<>(index.keySet())) {
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                IndexEntry entry = index.get(key);
                if (entry != null && isExpired(entry, now)) {
                    removeLocked(key, entry);
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        if (removed > 0) {
            log.info("[Cache] Evicted {} expired entries", removed);
        }
        return removed;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(index.size(), totalBytes.get(), settings.getCapacityBytes(), hits.get(), misses.get());
    }

    @Override
    public void clear() {
        int removed = 0;
        for (String key : new ArrayList<>(index.keySet())) {
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                IndexEntry entry = index.get(key);
                if (entry != null) {
                    removeLocked(key, entry);
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        log.info("[Cache] Cleared {} entries", removed);
    }

    /**
     * Evicts least recently accessed entries until the total fits the capacity.
     * The entry just stored and entries younger than the recency floor are kept.
     */
    private void enforceCapacity(String protectedKey) {
        long capacity = settings.getCapacityBytes();
        if (totalBytes.get() <= capacity) {
            return;
        }
        evictionLock.lock();
        try {
            int evicted = 0;
            int changed;
            int passes = 0;
            do {
                passes++;
                changed = 0;
                for (Candidate candidate : evictionCandidates(protectedKey)) {
                    if (totalBytes.get() <= capacity) {
                        break;
                    }
                    ReentrantLock lock = lockFor(candidate.key());
                    lock.lock();
                    try {
                        // Only the entry that was ranked; a newer store or lookup wins
                        if (removeLocked(candidate.key(), candidate.entry())) {
                            evicted++;
                        } else if (index.containsKey(candidate.key())) {
                            changed++;
                        }
                    } finally {
                        lock.unlock();
                    }
                }
            } while (changed > 0 && totalBytes.get() > capacity && passes < MAX_EVICTION_PASSES);

            if (evicted > 0) {
                log.info("[Cache] Evicted {} entries to fit capacity, now {} of {} bytes", evicted,
                        totalBytes.get(), capacity);
            }
            if (totalBytes.get() > capacity) {
                log.debug("[Cache] Over capacity by {} bytes, remaining entries are within the recency floor",
                        totalBytes.get() - capacity);
            }
        } finally {
            evictionLock.unlock();
        }
    }

    /**
     * Entries that may be evicted, least recently accessed first.
     */
    private List<Candidate> evictionCandidates(String protectedKey) {
        long now = clock.millis();
        long recencyFloor = settings.getRecencyFloor().toMillis();
        List<Candidate> candidates = new ArrayList<>();
        index.forEach((key, entry) -> {
            if (!key.equals(protectedKey) && now - entry.createdAt() >= recencyFloor) {
                candidates.add(new Candidate(key, entry));
            }
        });
        candidates.sort(Comparator.comparingLong((Candidate c) -> c.entry().lastAccessedAt())
                .thenComparingLong(c -> c.entry().createdAt()));
        return candidates;
    }

    private void touchQuietly(String key, long now) {
        try {
            CacheEntryFile.touch(fileFor(key), now);
        } catch (IOException e) {
            log.debug("[Cache] Could not persist access time of {}: {}", key, e.getMessage());
        }
    }

    private boolean isExpired(IndexEntry entry, long now) {
        if (now - entry.createdAt() <= settings.getTtl().toMillis()) {
            return false;
        }
        boolean historical = entry.windowEnd() != CacheEntryFile.NO_WINDOW
                && entry.windowEnd() < now - settings.getHistoricalAge().toMillis();
        return !historical;
    }

    // caller holds the key's stripe lock
    private boolean removeLocked(String key, IndexEntry entry) {
        if (!index.remove(key, entry)) {
            return false;
        }
        totalBytes.addAndGet(-entry.size());
        deleteQuietly(fileFor(key));
        return true;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[Cache] Failed to delete {}: {}", file, e.getMessage());
        }
    }

    ReentrantLock lockFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private Path fileFor(String key) {
        return directory.resolve(key + CacheEntryFile.SUFFIX);
    }

    Path getDirectory() {
        return directory;
    }

    private record IndexEntry(long createdAt, long lastAccessedAt, long windowEnd, long size) {

        IndexEntry accessedAt(long now) {
            return new IndexEntry(createdAt, now, windowEnd, size);
        }
    }

    private record Candidate(String key, IndexEntry entry) {
    }
}
