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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One retrieval call against the log store after parameter parsing.
 *
 * <p>
 * {@code scope} holds the exact group name for {@link OperationKind#FETCH} and
 * the optional name prefix for {@link OperationKind#ENUMERATE};
 * {@code scopes} holds the prefixes of a {@link OperationKind#SEARCH}.
 * {@code window} is {@code null} for enumerations.
 */
@Value
@Builder(toBuilder = true)
public class RetrievalRequest {

    OperationKind kind;
    String scope;
    List<String> scopes;
    TimeWindow window;
    String filterPattern;
    int limit;

    public boolean hasBoundedWindow() {
        return window != null;
    }

    public List<String> scopesOrEmpty() {
        return scopes != null ? scopes : List.of();
    }

    /**
     * Short human readable form used in logs and explanations. Never contains
     * retrieved data.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase(java.util.Locale.ROOT));
        if (kind == OperationKind.SEARCH) {
            sb.append(' ').append(scopesOrEmpty());
        } else if (scope != null) {
            sb.append(' ').append(scope);
        }
        if (window != null) {
            sb.append(" [").append(window.start()).append(" .. ").append(window.end()).append(']');
        }
        return sb.toString();
    }
}
