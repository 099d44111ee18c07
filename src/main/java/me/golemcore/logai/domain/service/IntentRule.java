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

import java.util.regex.Pattern;

/**
 * Phrase pattern that signals a stated intention. Rules that are not
 * {@code actionable} are recognized but never trigger a nudge.
 */
public record IntentRule(IntentType type, Pattern pattern, double confidence, boolean actionable,
        String suggestedAction) {

    public static IntentRule of(IntentType type, String regex, double confidence, String suggestedAction) {
        return new IntentRule(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                confidence, true, suggestedAction);
    }

    public static IntentRule informational(IntentType type, String regex, double confidence) {
        return new IntentRule(type, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                confidence, false, null);
    }
}
