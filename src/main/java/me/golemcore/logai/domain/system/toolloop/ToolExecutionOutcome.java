package me.golemcore.logai.domain.system.toolloop;

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

import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ToolFailureKind;
import me.golemcore.logai.domain.model.ToolResult;

/**
 * Result of a single tool dispatch (real or synthetic).
 *
 * @param toolCallId
 *            tool call id the result answers; for automatic retries this is the
 *            synthetic id recorded in history
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult
 * @param messageContent
 *            content written into the "tool" message
 * @param synthetic
 *            whether this result was produced without executing the tool
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome of(String toolCallId, String toolName, ToolResult result) {
        String content = result.getOutput() != null
                ? result.getOutput()
                : "Error (" + result.getFailureKind() + "): " + result.getError();
        return new ToolExecutionOutcome(toolCallId, toolName, result, content, false);
    }

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "Error (" + kind + "): " + reason, true);
    }
}
