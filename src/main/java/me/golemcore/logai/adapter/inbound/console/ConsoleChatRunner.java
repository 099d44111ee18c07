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

package me.golemcore.logai.adapter.inbound.console;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolCallStatus;
import me.golemcore.logai.domain.model.ToolLoopStats;
import me.golemcore.logai.domain.model.TurnResult;
import me.golemcore.logai.domain.service.ConversationService;
import me.golemcore.logai.domain.system.toolloop.TurnOrchestrator;
import me.golemcore.logai.port.outbound.ResultCachePort;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Interactive terminal chat. Plain lines are questions; lines starting with a
 * slash are commands handled without the model. Turns run in the background
 * so {@code /cancel} can interrupt them.
 */
@Component
@ConditionalOnProperty(prefix = "logai.console", name = "enabled", havingValue = "true")
@Slf4j
public class ConsoleChatRunner implements CommandLineRunner {

    private static final String HELP = """
            Commands:
              /cache          show cache statistics
              /cache prune    remove expired cache entries
              /cache clear    remove every cache entry
              /stats          show retry, nudge and tool call limit counters
              /clear          start over with an empty history
              /refresh        reload the log group list
              /cancel         cancel the running request
              /help           show this help
              /quit           exit""";

    private final ConversationService conversations;
    private final ResultCachePort cache;
    private final InputStream in;
    private final PrintStream out;
    private final ExecutorService turnExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "logai-console-turn");
        t.setDaemon(true);
        return t;
    });

    private volatile CompletableFuture<TurnResult> runningTurn;

    public ConsoleChatRunner(ConversationService conversations, ResultCachePort cache) {
        this(conversations, cache, System.in, System.out);
    }

    // Visible for testing
    ConsoleChatRunner(ConversationService conversations, ResultCachePort cache, InputStream in, PrintStream out) {
        this.conversations = conversations;
        this.cache = cache;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(String... args) throws IOException {
        TurnOrchestrator orchestrator = conversations.open();
        Disposable fragments = orchestrator.answerFragments().subscribe(out::print);
        Disposable records = orchestrator.toolCallRecords()
                .filter(record -> record.getStatus().isTerminal())
                .subscribe(this::printRecord);
        out.println("LogAI ready. Ask about your logs, or type /help.");
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            boolean quit = false;
            while (!quit && (line = reader.readLine()) != null) {
                String input = line.strip();
                if (input.isEmpty()) {
                    continue;
                }
                if (input.startsWith("/")) {
                    quit = !handleCommand(orchestrator, input);
                } else {
                    submit(orchestrator, input);
                }
            }
            if (!quit) {
                awaitRunningTurn();
            }
        } finally {
            orchestrator.cancelTurn();
            fragments.dispose();
            records.dispose();
            turnExecutor.shutdownNow();
        }
    }

    /**
     * @return {@code false} when the user asked to quit
     */
    boolean handleCommand(TurnOrchestrator orchestrator, String input) {
        String[] parts = input.substring(1).trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].toLowerCase(Locale.ROOT) : "";
        switch (command) {
        case "quit", "exit" -> {
            return false;
        }
        case "cancel" -> {
            if (isTurnRunning()) {
                orchestrator.cancelTurn();
            } else {
                out.println("Nothing to cancel.");
            }
        }
        case "clear" -> {
            if (isTurnRunning()) {
                out.println("A request is running. Use /cancel first.");
            } else {
                orchestrator.clearHistory();
                out.println("History cleared.");
            }
        }
        case "refresh" -> out.println("Log group list reloaded: " + conversations.refreshCatalog() + " groups.");
        case "cache" -> handleCache(argument);
        case "stats" -> printStats(orchestrator.toolLoopStats());
        case "help" -> out.println(HELP);
        default -> out.println("Unknown command /" + command + ". Type /help.");
        }
        return true;
    }

    private void handleCache(String argument) {
        switch (argument) {
        case "prune" -> out.println("Removed " + cache.evictExpired() + " expired entries.");
        case "clear" -> {
            cache.clear();
            out.println("Cache cleared.");
        }
        default -> {
            CacheStats stats = cache.stats();
            out.printf(Locale.ROOT, "Cache: %d entries, %.1f of %.1f MB, hit rate %.0f%% (%d hits, %d misses)%n",
                    stats.entryCount(), stats.totalBytes() / 1_048_576.0, stats.capacityBytes() / 1_048_576.0,
                    stats.hitRate() * 100, stats.hits(), stats.misses());
        }
        }
    }

    private void printStats(ToolLoopStats stats) {
        out.printf(Locale.ROOT, "Tool loop: %d retries (%d exhausted), %d nudges, %d limit stops, %d merged calls%n",
                stats.retries(), stats.retriesExhausted(), stats.nudges(), stats.capHits(), stats.mergedCalls());
    }

    private void submit(TurnOrchestrator orchestrator, String question) {
        if (isTurnRunning()) {
            out.println("A request is still running. Wait for it or use /cancel.");
            return;
        }
        runningTurn = CompletableFuture.supplyAsync(() -> orchestrator.processTurn(question), turnExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("[Console] Turn failed", error);
                        out.println();
                        out.println("Error: " + error.getMessage());
                    } else if (result.isCancelled()) {
                        out.println();
                        out.println("(cancelled)");
                    } else {
                        out.println();
                    }
                });
    }

    /**
     * Piped input ends right after the last question; let that turn finish.
     * Failures were already printed by {@link #submit}.
     */
    private void awaitRunningTurn() {
        CompletableFuture<TurnResult> turn = runningTurn;
        if (turn != null) {
            turn.handle((result, error) -> result).join();
        }
    }

    private boolean isTurnRunning() {
        CompletableFuture<TurnResult> turn = runningTurn;
        return turn != null && !turn.isDone();
    }

    private void printRecord(ToolCallRecord record) {
        String marker = record.getStatus() == ToolCallStatus.SUCCEEDED ? "ok" : "failed";
        String detail = record.getStatus() == ToolCallStatus.SUCCEEDED
                ? record.getResultSummary()
                : record.getFailureCause();
        out.printf(Locale.ROOT, "%n[%s%s] %s in %d ms: %s%n", record.getToolName(),
                record.isRetry() ? " retry " + record.getRetryAttempt() : "", marker, record.elapsed().toMillis(),
                detail);
    }
}
