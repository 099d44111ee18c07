package me.golemcore.logai.security;

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

import java.util.regex.Pattern;

/**
 * One redaction rule: a pattern and the placeholder every match is replaced
 * with. The replacement may reference capture groups.
 */
public record RedactionRule(String name, String label, Pattern pattern, String replacement) {

    public static RedactionRule of(String name, String label, String regex, String replacement) {
        return new RedactionRule(name, label, Pattern.compile(regex), replacement);
    }
}
