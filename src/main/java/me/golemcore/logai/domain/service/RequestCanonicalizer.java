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

import me.golemcore.logai.domain.model.OperationKind;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.TimeWindow;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Brings retrieval requests to canonical form and derives their signature.
 *
 * <p>
 * Two requests are equivalent when their canonical forms are equal: scopes
 * trimmed, search scope sets de-duplicated and sorted, prefix scopes optionally
 * case-folded, window bounds truncated to the second, blank filters dropped.
 * Exact group names keep their case. The signature is the SHA-256 of the
 * canonical form and keys both the result cache and the per-turn retry
 * counters.
 */
@Component
public class RequestCanonicalizer {

    private final boolean foldPrefixCase;

    @Autowired
    public RequestCanonicalizer(LogAiProperties properties) {
        this(properties.getCache().isCaseInsensitivePrefixes());
    }

    public RequestCanonicalizer(boolean foldPrefixCase) {
        this.foldPrefixCase = foldPrefixCase;
    }

    public RetrievalRequest canonicalize(RetrievalRequest request) {
        RetrievalRequest.RetrievalRequestBuilder builder = request.toBuilder();
        switch (request.getKind()) {
        case ENUMERATE -> builder.scope(blankToNull(prefix(request.getScope()))).scopes(null).window(null);
        case FETCH -> builder.scope(request.getScope() == null ? null : request.getScope().trim()).scopes(null);
        case SEARCH -> {
            TreeSet<String> scopes = new TreeSet<>();
            for (String scope : request.scopesOrEmpty()) {
                String canonical = prefix(scope);
                if (canonical != null && !canonical.isEmpty()) {
                    scopes.add(canonical);
                }
            }
            builder.scope(null).scopes(List.copyOf(scopes));
        }
        default -> throw new IllegalStateException("Unknown operation kind: " + request.getKind());
        }
        TimeWindow window = request.getWindow();
        if (window != null && request.getKind() != OperationKind.ENUMERATE) {
            builder.window(window.truncatedToSeconds());
        }
        builder.filterPattern(blankToNull(request.getFilterPattern() == null ? null
                : request.getFilterPattern().trim()));
        return builder.build();
    }

    /**
     * SHA-256 hex digest of the canonical form.
     */
    public String signature(RetrievalRequest request) {
        RetrievalRequest canonical = canonicalize(request);
        StringBuilder sb = new StringBuilder(128);
        sb.append("kind=").append(canonical.getKind().name()).append('\n');
        sb.append("scope=").append(escape(canonical.getScope())).append('\n');
        sb.append("scopes=");
        for (String scope : canonical.scopesOrEmpty()) {
            sb.append(escape(scope)).append(',');
        }
        sb.append('\n');
        TimeWindow window = canonical.getWindow();
        sb.append("start=").append(window != null ? window.startMillis() : "-").append('\n');
        sb.append("end=").append(window != null ? window.endMillis() : "-").append('\n');
        sb.append("filter=").append(escape(canonical.getFilterPattern())).append('\n');
        sb.append("limit=").append(canonical.getLimit());
        return sha256(sb.toString());
    }

    private String prefix(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return foldPrefixCase ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // null and empty must not collide; commas and newlines separate fields
    private static String escape(String value) {
        if (value == null) {
            return "\u0000";
        }
        return value.replace("\\", "\\\\").replace(",", "\\,").replace("\n", "\\n");
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
