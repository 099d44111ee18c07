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

import java.util.List;

/**
 * Single point of mutation for conversation history during a turn.
 *
 * <p>
 * The orchestrator writes each step into a buffer through this interface and
 * appends the buffer to the committed history once the step completes.
 */
public interface HistoryWriter {

    void appendUserMessage(List<Message> messages, String text);

    void appendAssistantToolCalls(List<Message> messages, String content, List<Message.ToolCall> toolCalls);

    /**
     * Records a retry the orchestrator issued on its own as an assistant tool
     * call, so the following tool result has a call to answer.
     */
    void appendAutoRetryCall(List<Message> messages, String note, Message.ToolCall toolCall);

    void appendToolResult(List<Message> messages, ToolExecutionOutcome outcome);

    /**
     * Assistant text that did not end the turn, such as an announcement that was
     * followed by a nudge.
     */
    void appendAssistantText(List<Message> messages, String text);

    void appendSystemNudge(List<Message> messages, String text);

    void appendSystemContext(List<Message> messages, String text);

    void appendFinalAssistantAnswer(List<Message> messages, String finalText);
}
