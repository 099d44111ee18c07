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

import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolCallStatus;
import me.golemcore.logai.domain.model.ToolKind;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Journal of the tool calls dispatched in one conversation.
 *
 * <p>
 * Keeps the latest snapshot of every record in dispatch order and publishes
 * each transition to live subscribers. A late subscriber gets the current
 * snapshot first, then live updates.
 */
public class ToolCallJournal {

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, ToolCallRecord> records = new LinkedHashMap<>();
    private final Sinks.Many<ToolCallRecord> updates = Sinks.many().multicast().directBestEffort();
    private long sequence;

    public ToolCallJournal(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates a {@code PENDING} record.
     */
    public ToolCallRecord open(String sourceToolCallId, String toolName, ToolKind kind,
            Map<String, Object> parameters, int retryAttempt) {
        synchronized (lock) {
            sequence++;
            ToolCallRecord record = ToolCallRecord.builder()
                    .id("tc-" + sequence)
                    .sourceToolCallId(sourceToolCallId)
                    .toolName(toolName)
                    .kind(kind)
                    .parameters(parameters != null ? Map.copyOf(parameters) : Map.of())
                    .status(ToolCallStatus.PENDING)
                    .retryAttempt(retryAttempt)
                    .startedAt(clock.instant())
                    .build();
            publish(record);
            return record;
        }
    }

    public ToolCallRecord markRunning(ToolCallRecord record) {
        return update(record.running(clock.instant()));
    }

    public ToolCallRecord markSucceeded(ToolCallRecord record, String summary) {
        return update(record.succeeded(summary, clock.instant()));
    }

    public ToolCallRecord markFailed(ToolCallRecord record, String cause) {
        return update(record.failed(cause, clock.instant()));
    }

    /**
     * Fails every record that has not reached a terminal status.
     *
     * @return number of records failed
     */
    public int failUnfinished(String cause) {
        synchronized (lock) {
            List<ToolCallRecord> unfinished = records.values().stream()
                    .filter(record -> !record.getStatus().isTerminal())
                    .toList();
            unfinished.forEach(record -> publish(record.failed(cause, clock.instant())));
            return unfinished.size();
        }
    }

    /**
     * Live updates, preceded by the snapshot current at subscription time.
     */
    public Flux<ToolCallRecord> stream() {
        return Flux.create(sink -> {
            // Publishing holds the same lock, so no update falls between snapshot and subscription
            synchronized (lock) {
                new ArrayList<>(records.values()).forEach(sink::next);
                Disposable live = updates.asFlux().subscribe(sink::next, sink::error, sink::complete);
                sink.onDispose(live);
            }
        });
    }

    public List<ToolCallRecord> snapshot() {
        synchronized (lock) {
            return List.copyOf(records.values());
        }
    }

    public void clear() {
        synchronized (lock) {
            records.clear();
        }
    }

    private ToolCallRecord update(ToolCallRecord record) {
        synchronized (lock) {
            ToolCallRecord current = records.get(record.getId());
            // A terminal record never moves again, e.g. a late completion after cancellation
            if (current != null && current.getStatus().isTerminal()) {
                return current;
            }
            publish(record);
            return record;
        }
    }

    private void publish(ToolCallRecord record) {
        records.put(record.getId(), record);
        updates.tryEmitNext(record);
    }
}
