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

import me.golemcore.logai.domain.model.IntentType;

import java.util.List;

/**
 * Ordered rules used by {@link IntentDetector}. Replace the bean to change the
 * recognized phrases without touching the turn loop.
 */
public class IntentRuleSet {

    private static final String FIRST_PERSON_FUTURE = "\\b(?:i['\u2019]?ll|let me|i will|i['\u2019]?m going to)\\s+";

    private final List<IntentRule> rules;

    public IntentRuleSet(List<IntentRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<IntentRule> rules() {
        return rules;
    }

    /**
     * First-person future-tense statements about retrieval actions.
     */
    public static IntentRuleSet defaults() {
        return new IntentRuleSet(List.of(
                IntentRule.of(IntentType.SEARCH_LOGS,
                        FIRST_PERSON_FUTURE
                                + "(?:search|look|check|fetch|find|query|examine|investigate|retrieve|pull)\\b",
                        0.9, "Use fetch_logs or search_logs"),
                IntentRule.of(IntentType.LIST_GROUPS,
                        FIRST_PERSON_FUTURE
                                + "(?:list|show|display|get)\\s+(?:the\\s+)?(?:available\\s+)?log\\s*groups?\\b",
                        0.9, "Use list_log_groups"),
                IntentRule.of(IntentType.EXPAND_TIME,
                        "\\b(?:expand|widen|broaden|increase|extend)\\s+(?:the\\s+)?(?:time\\s*)?"
                                + "(?:range|window|period|search)\\b",
                        0.8, "Call fetch_logs or search_logs again with an earlier start_time"),
                IntentRule.of(IntentType.CHANGE_FILTER,
                        "\\b(?:try|use)\\s+(?:a\\s+)?(?:different|another|broader|narrower)\\s+"
                                + "(?:filter|pattern|search)\\b",
                        0.8, "Call the tool again with a different filter_pattern"),
                IntentRule.informational(IntentType.ANALYZE,
                        FIRST_PERSON_FUTURE + "(?:analy[sz]e|summari[sz]e|review)\\b",
                        0.5)));
    }
}
