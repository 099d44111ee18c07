package me.golemcore.logai.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw, unredacted result of one remote retrieval. This is what the result cache
 * stores; it is never handed to the model without passing the redactor first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedPayload {

    @Builder.Default
    private List<LogGroup> groups = new ArrayList<>();

    @Builder.Default
    private List<LogEvent> events = new ArrayList<>();

    private boolean truncated;

    public static CachedPayload ofGroups(List<LogGroup> groups, boolean truncated) {
        return CachedPayload.builder().groups(new ArrayList<>(groups)).truncated(truncated).build();
    }

    public static CachedPayload ofEvents(List<LogEvent> events, boolean truncated) {
        return CachedPayload.builder().events(new ArrayList<>(events)).truncated(truncated).build();
    }

    @JsonIgnore
    public int itemCount() {
        return (groups != null ? groups.size() : 0) + (events != null ? events.size() : 0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return itemCount() == 0;
    }
}
