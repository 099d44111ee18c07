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

import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.domain.model.LogGroup;
import me.golemcore.logai.domain.model.TimeWindow;

import java.util.List;

/**
 * Port for the remote log store.
 *
 * <p>
 * Every operation may fail with
 * {@link me.golemcore.logai.domain.exception.LogStoreUnavailableException},
 * {@link me.golemcore.logai.domain.exception.RateLimitedException},
 * {@link me.golemcore.logai.domain.exception.ScopeNotFoundException} or
 * {@link me.golemcore.logai.domain.exception.InvalidParametersException}.
 * Callers that need to detect truncation ask for one item more than they
 * intend to return.
 */
public interface LogStorePort {

    /**
     * Lists log groups whose name starts with {@code prefix} (all groups when
     * {@code null}), at most {@code limit} of them.
     */
    List<LogGroup> listLogGroups(String prefix, int limit);

    /**
     * Reads events of one log group, newest first.
     */
    List<LogEvent> fetchEvents(String logGroup, TimeWindow window, String filterPattern, int limit);

    /**
     * Reads events of every log group matching any of the prefixes, newest first.
     */
    List<LogEvent> searchEvents(List<String> prefixes, TimeWindow window, String filterPattern, int limit);
}
