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

package me.golemcore.logai.adapter.outbound.logstore;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.exception.InvalidParametersException;
import me.golemcore.logai.domain.exception.LogAiException;
import me.golemcore.logai.domain.exception.LogStoreUnavailableException;
import me.golemcore.logai.domain.exception.RateLimitedException;
import me.golemcore.logai.domain.exception.ScopeNotFoundException;
import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.domain.model.LogGroup;
import me.golemcore.logai.domain.model.TimeWindow;
import me.golemcore.logai.port.outbound.LogStorePort;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogGroupsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.DescribeLogGroupsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilterLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.FilteredLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidParameterException;
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link LogStorePort} backed by AWS CloudWatch Logs.
 *
 * <p>
 * Pages through {@code DescribeLogGroups} and {@code FilterLogEvents} until the
 * requested number of items is collected. SDK errors are translated to the
 * domain failure kinds; rate limit backoff is left to the caller.
 */
@Component
@Slf4j
public class CloudWatchLogStoreAdapter implements LogStorePort {

    private static final int DESCRIBE_PAGE_MAX = 50;
    private static final int FILTER_PAGE_MAX = 10_000;
    private static final int SEARCH_GROUPS_PER_PREFIX = 100;
    private static final int MIN_EVENTS_PER_GROUP = 10;

    private final CloudWatchLogsClient client;

    public CloudWatchLogStoreAdapter(CloudWatchLogsClient client) {
        this.client = client;
    }

    @Override
    public List<LogGroup> listLogGroups(String prefix, int limit) {
        return call("list log groups" + (prefix != null ? " with prefix " + prefix : ""), prefix,
                () -> describe(prefix, limit));
    }

    @Override
    public List<LogEvent> fetchEvents(String logGroup, TimeWindow window, String filterPattern, int limit) {
        List<LogEvent> events = call("fetch logs from " + logGroup, logGroup,
                () -> filter(logGroup, window, filterPattern, limit));
        events.sort(Comparator.comparingLong(LogEvent::getTimestamp).reversed());
        return events;
    }

    @Override
    public List<LogEvent> searchEvents(List<String> prefixes, TimeWindow window, String filterPattern, int limit) {
        Set<String> groups = new LinkedHashSet<>();
        for (String prefix : prefixes) {
            listLogGroups(prefix, SEARCH_GROUPS_PER_PREFIX).forEach(group -> groups.add(group.getName()));
        }
        if (groups.isEmpty()) {
            throw new ScopeNotFoundException("No log groups match " + String.join(", ", prefixes));
        }

        int perGroupLimit = Math.max(limit / groups.size(), MIN_EVENTS_PER_GROUP);
        List<LogEvent> events = new ArrayList<>();
        for (String group : groups) {
            try {
                events.addAll(fetchEvents(group, window, filterPattern, perGroupLimit));
            } catch (ScopeNotFoundException e) {
                log.debug("[CloudWatch] Log group {} disappeared during search, skipping", group);
                continue;
            }
            if (events.size() >= limit) {
                break;
            }
        }
        events.sort(Comparator.comparingLong(LogEvent::getTimestamp).reversed());
        return events.size() > limit ? new ArrayList<>(events.subList(0, limit)) : events;
    }

    private List<LogGroup> describe(String prefix, int limit) {
        List<LogGroup> groups = new ArrayList<>();
        String nextToken = null;
        do {
            DescribeLogGroupsRequest.Builder request = DescribeLogGroupsRequest.builder()
                    .limit(Math.min(DESCRIBE_PAGE_MAX, Math.max(1, limit - groups.size())));
            if (prefix != null && !prefix.isBlank()) {
                request.logGroupNamePrefix(prefix);
            }
            if (nextToken != null) {
                request.nextToken(nextToken);
            }
            DescribeLogGroupsResponse response = client.describeLogGroups(request.build());
            for (software.amazon.awssdk.services.cloudwatchlogs.model.LogGroup group : response.logGroups()) {
                groups.add(LogGroup.builder()
                        .name(group.logGroupName())
                        .createdAt(group.creationTime())
                        .storedBytes(group.storedBytes())
                        .retentionDays(group.retentionInDays())
                        .build());
                if (groups.size() >= limit) {
                    return groups;
                }
            }
            nextToken = response.nextToken();
        } while (nextToken != null);
        return groups;
    }

    private List<LogEvent> filter(String logGroup, TimeWindow window, String filterPattern, int limit) {
        List<LogEvent> events = new ArrayList<>();
        String nextToken = null;
        do {
            FilterLogEventsRequest.Builder request = FilterLogEventsRequest.builder()
                    .logGroupName(logGroup)
                    .startTime(window.startMillis())
                    .endTime(window.endMillis())
                    .limit(Math.min(FILTER_PAGE_MAX, Math.max(1, limit - events.size())));
            if (filterPattern != null && !filterPattern.isBlank()) {
                request.filterPattern(filterPattern);
            }
            if (nextToken != null) {
                request.nextToken(nextToken);
            }
            FilterLogEventsResponse response = client.filterLogEvents(request.build());
            for (FilteredLogEvent event : response.events()) {
                events.add(LogEvent.builder()
                        .timestamp(event.timestamp() != null ? event.timestamp() : 0L)
                        .message(event.message())
                        .logGroup(logGroup)
                        .logStream(event.logStreamName())
                        .eventId(event.eventId())
                        .build());
                if (events.size() >= limit) {
                    return events;
                }
            }
            nextToken = response.nextToken();
        } while (nextToken != null);
        return events;
    }

    private <T> T call(String operation, String scope, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw translate(operation, scope, e);
        }
    }

    static LogAiException translate(String operation, String scope, SdkException e) {
        if (e instanceof ResourceNotFoundException) {
            return new ScopeNotFoundException("Log group not found: " + scope, e);
        }
        if (e instanceof InvalidParameterException) {
            return new InvalidParametersException("Invalid parameter: " + errorMessage(e)
                    + ". Check the filter pattern syntax.", e);
        }
        if (e instanceof LimitExceededException) {
            return new RateLimitedException("CloudWatch limit exceeded: " + errorMessage(e), e);
        }
        if (e instanceof AwsServiceException service) {
            if (service.isThrottlingException()) {
                return new RateLimitedException("CloudWatch rate limit exceeded: " + errorMessage(e), e);
            }
            String code = service.awsErrorDetails() != null ? service.awsErrorDetails().errorCode() : null;
            if ("AccessDeniedException".equals(code)) {
                return new LogStoreUnavailableException("Access denied to CloudWatch Logs (" + operation
                        + "). Check AWS credentials and IAM permissions.", e);
            }
            return new LogStoreUnavailableException("Failed to " + operation + ": " + code + " - "
                    + errorMessage(e), e);
        }
        if (e instanceof SdkClientException) {
            return new LogStoreUnavailableException("CloudWatch Logs is unreachable (" + operation + "): "
                    + e.getMessage(), e);
        }
        return new LogStoreUnavailableException("Failed to " + operation + ": " + e.getMessage(), e);
    }

    private static String errorMessage(SdkException e) {
        if (e instanceof AwsServiceException service && service.awsErrorDetails() != null
                && service.awsErrorDetails().errorMessage() != null) {
            return service.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }
}
