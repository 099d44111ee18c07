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
import me.golemcore.logai.domain.exception.LogAiException;
import me.golemcore.logai.domain.model.LogGroup;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LogStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory catalog of the account's log groups, rendered into the system
 * prompt so the model knows valid names without a discovery call.
 *
 * <p>
 * Small catalogs are listed in full. Large ones are rendered as counts per
 * name category plus a sample drawn proportionally from each category.
 * {@link #refresh()} reloads and returns a context update for conversations
 * that are already running.
 */
@Service
@Slf4j
public class LogGroupCatalogService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);
    private static final int MAX_CATEGORIES = 15;
    private static final List<String> KNOWN_PREFIXES = List.of(
            "/aws/lambda/", "/aws/apigateway/", "/aws/rds/", "/aws/eks/", "/ecs/", "/aws/elasticbeanstalk/",
            "/aws/codebuild/", "/aws/batch/", "/aws/kinesisfirehose/", "/aws/vendedlogs/");

    private final LogStorePort logStore;
    private final LogAiProperties.CatalogProperties settings;
    private final Clock clock;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public LogGroupCatalogService(LogStorePort logStore, LogAiProperties properties, Clock clock) {
        this.logStore = logStore;
        this.settings = properties.getCatalog();
        this.clock = clock;
    }

    /**
     * Loads all log groups, bounded by {@code logai.catalog.max-groups}. A
     * failure keeps the previous snapshot.
     *
     * @return number of groups now in the catalog
     */
    public int load() {
        try {
            List<LogGroup> groups = new ArrayList<>(logStore.listLogGroups(null, settings.getMaxGroups()));
            groups.sort(Comparator.comparing(LogGroup::getName));
            snapshot.set(new Snapshot(List.copyOf(groups), clock.instant()));
            lastError.set(null);
            log.info("[Catalog] Loaded {} log groups", groups.size());
            return groups.size();
        } catch (LogAiException e) {
            lastError.set(e.getMessage());
            log.warn("[Catalog] Failed to load log groups: {}", e.getMessage());
            Snapshot current = snapshot.get();
            return current != null ? current.groups().size() : 0;
        }
    }

    /**
     * Reloads the catalog and returns the text to hand to running conversations.
     */
    public String refresh() {
        int count = load();
        return "The log group catalog was refreshed and now lists " + count + " log groups.\n\n"
                + formatForPrompt();
    }

    public List<LogGroup> groups() {
        Snapshot current = snapshot.get();
        return current != null ? current.groups() : List.of();
    }

    public boolean isLoaded() {
        return snapshot.get() != null;
    }

    public String formatForPrompt() {
        Snapshot current = snapshot.get();
        if (current == null || current.groups().isEmpty()) {
            return formatEmpty(current);
        }
        if (current.groups().size() <= settings.getFullListThreshold()) {
            return formatFullList(current);
        }
        return formatSummary(current);
    }

    private String formatEmpty(Snapshot current) {
        String error = lastError.get();
        if (error != null) {
            return "## Log Groups\n\nThe log group list could not be loaded (" + error + ").\n"
                    + "Discover log groups with the list_log_groups tool.\n";
        }
        if (current == null) {
            return "## Log Groups\n\nThe log group list has not been loaded yet.\n"
                    + "Discover log groups with the list_log_groups tool.\n";
        }
        return "## Log Groups\n\nNo log groups were found in this account and region. The credentials may lack "
                + "permission to list them.\n";
    }

    private String formatFullList(Snapshot current) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Available Log Groups\n\n");
        sb.append(current.groups().size()).append(" log groups, updated ")
                .append(TIME_FORMAT.format(current.loadedAt())).append("\n\n");
        for (LogGroup group : current.groups()) {
            sb.append("- ").append(group.getName()).append('\n');
        }
        sb.append("\nUse these names directly with fetch_logs. Call list_log_groups only when the user asks for a "
                + "fresh list. If a requested name does not match, suggest the closest one from this list.\n");
        return sb.toString();
    }

    private String formatSummary(Snapshot current) {
        List<LogGroup> groups = current.groups();
        Map<String, Long> categories = categorize(groups);
        List<LogGroup> sample = sample(groups, categories);

        StringBuilder sb = new StringBuilder();
        sb.append("## Available Log Groups\n\n");
        sb.append(groups.size()).append(" log groups, updated ")
                .append(TIME_FORMAT.format(current.loadedAt())).append("\n\n");
        sb.append("### Categories\n");
        categories.entrySet().stream()
                .limit(MAX_CATEGORIES)
                .forEach(entry -> sb.append("- ").append(entry.getKey()).append("*: ")
                        .append(entry.getValue()).append(" log groups\n"));
        sb.append("\n### Sample (").append(sample.size()).append(" of ").append(groups.size()).append(")\n");
        for (LogGroup group : sample) {
            sb.append("- ").append(group.getName()).append('\n');
        }
        sb.append("\nThe full list is too large to show. Use search_logs with a category prefix, or "
                + "list_log_groups with a prefix to find exact names.\n");
        return sb.toString();
    }

    /**
     * Counts groups per category, largest first.
     */
    Map<String, Long> categorize(List<LogGroup> groups) {
        Map<String, Long> counts = groups.stream()
                .collect(Collectors.groupingBy(group -> category(group.getName()), Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    static String category(String name) {
        for (String prefix : KNOWN_PREFIXES) {
            if (name.startsWith(prefix)) {
                return prefix;
            }
        }
        String[] parts = name.split("/", -1);
        if (parts.length >= 3) {
            return String.join("/", parts[0], parts[1], parts[2]) + "/";
        }
        if (parts.length == 2) {
            return parts[0] + "/" + parts[1] + "/";
        }
        return "(other)";
    }

    private List<LogGroup> sample(List<LogGroup> groups, Map<String, Long> categories) {
        int size = settings.getSummarySampleSize();
        if (groups.size() <= size) {
            return groups;
        }
        List<LogGroup> sample = new ArrayList<>(size);
        for (Map.Entry<String, Long> category : categories.entrySet()) {
            int allocation = (int) Math.max(1, size * category.getValue() / groups.size());
            groups.stream()
                    .filter(group -> category(group.getName()).equals(category.getKey()))
                    .limit(allocation)
                    .forEach(sample::add);
            if (sample.size() >= size) {
                break;
            }
        }
        sample.sort(Comparator.comparing(LogGroup::getName));
        return sample.size() > size ? sample.subList(0, size) : sample;
    }

    private record Snapshot(List<LogGroup> groups, Instant loadedAt) {
    }
}
