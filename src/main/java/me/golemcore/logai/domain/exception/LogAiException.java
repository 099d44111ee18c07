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
 * Root of all project exceptions. Carries the tool failure classification when
 * the error surfaces as a tool result.
 */
public class LogAiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ToolFailureKind failureKind;

    public LogAiException(String message) {
        this(message, ToolFailureKind.EXECUTION_FAILED, null);
    }

    public LogAiException(String message, Throwable cause) {
        this(message, ToolFailureKind.EXECUTION_FAILED, cause);
    }

    protected LogAiException(String message, ToolFailureKind failureKind, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public ToolFailureKind getFailureKind() {
        return failureKind;
    }
}
