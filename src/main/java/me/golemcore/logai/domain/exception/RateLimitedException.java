package me.golemcore.logai.domain.exception;

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

import me.golemcore.logai.domain.model.ToolFailureKind;

/**
 * The log store throttled the request. Retried with backoff inside the
 * retrieval service before it reaches the model.
 */
public class RateLimitedException extends LogAiException {

    private static final long serialVersionUID = 1L;

    public RateLimitedException(String message) {
        this(message, null);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, ToolFailureKind.RATE_LIMITED, cause);
    }
}
