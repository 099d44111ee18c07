package me.golemcore.logai.domain.system.toolloop;

import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolCallStatus;
import me.golemcore.logai.domain.model.ToolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ToolCallJournalTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-14T00:00:00Z");

    private ToolCallJournal journal;

    @BeforeEach
    void setUp() {
        journal = new ToolCallJournal(Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC")));
    }

    private ToolCallRecord open(String sourceId) {
        return journal.open(sourceId, "fetch_logs", ToolKind.FETCH_LOGS, Map.of("log_group", "/g"), 0);
    }

    @Test
    void shouldCreatePendingRecordsWithDistinctIds() {
        ToolCallRecord first = open("call-1");
        ToolCallRecord second = open("call-2");

        assertEquals(ToolCallStatus.PENDING, first.getStatus());
        assertEquals(FIXED_INSTANT, first.getStartedAt());
        assertNotEquals(first.getId(), second.getId());
        assertEquals(List.of(first, second), journal.snapshot());
    }

    @Test
    void shouldWalkThroughLifecycle() {
        ToolCallRecord record = open("call-1");

        ToolCallRecord running = journal.markRunning(record);
        ToolCallRecord done = journal.markSucceeded(running, "3 events from /g");

        assertEquals(ToolCallStatus.RUNNING, running.getStatus());
        assertEquals(ToolCallStatus.SUCCEEDED, done.getStatus());
        assertEquals("3 events from /g", done.getResultSummary());
        assertEquals(FIXED_INSTANT, done.getCompletedAt());
        assertEquals(List.of(done), journal.snapshot());
    }

    @Test
    void shouldNeverMoveTerminalRecord() {
        ToolCallRecord running = journal.markRunning(open("call-1"));
        ToolCallRecord failed = journal.markFailed(running, "Cancelled by user");

        ToolCallRecord late = journal.markSucceeded(running, "late result");

        assertEquals(failed, late);
        assertEquals(ToolCallStatus.FAILED, journal.snapshot().get(0).getStatus());
    }

    @Test
    void shouldFailOnlyUnfinishedRecords() {
        journal.markSucceeded(journal.markRunning(open("call-1")), "ok");
        journal.markRunning(open("call-2"));
        open("call-3");

        assertEquals(2, journal.failUnfinished("Cancelled by user"));

        List<ToolCallRecord> records = journal.snapshot();
        assertEquals(ToolCallStatus.SUCCEEDED, records.get(0).getStatus());
        assertEquals("Cancelled by user", records.get(1).getFailureCause());
        assertEquals(ToolCallStatus.FAILED, records.get(2).getStatus());
    }

    @Test
    void shouldReplaySnapshotThenLiveUpdates() {
        ToolCallRecord existing = open("call-1");

        StepVerifier.create(journal.stream())
                .expectNext(existing)
                .then(() -> journal.markRunning(existing))
                .assertNext(record -> assertEquals(ToolCallStatus.RUNNING, record.getStatus()))
                .thenCancel()
                .verify();
    }

    @Test
    void shouldReplayRecordsOpenedBeforeSubscription() {
        ToolCallRecord first = open("call-1");
        Flux<ToolCallRecord> stream = journal.stream();
        ToolCallRecord second = open("call-2");

        StepVerifier.create(stream)
                .expectNext(first, second)
                .then(() -> journal.markRunning(second))
                .assertNext(record -> assertEquals(ToolCallStatus.RUNNING, record.getStatus()))
                .thenCancel()
                .verify();
    }

    @Test
    void shouldNotLoseUpdatesWhileSubscribing() throws InterruptedException {
        Thread writer = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                open("call-" + i);
            }
        });
        List<ToolCallRecord> seen = new CopyOnWriteArrayList<>();
        writer.start();
        Disposable subscription = journal.stream().subscribe(seen::add);
        writer.join(5000);
        subscription.dispose();

        assertEquals(journal.snapshot(), seen);
    }

    @Test
    void shouldForgetRecordsOnClear() {
        open("call-1");

        journal.clear();

        assertEquals(List.of(), journal.snapshot());
    }
}
