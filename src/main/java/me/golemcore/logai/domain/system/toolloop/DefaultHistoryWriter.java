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

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation that appends timestamped messages to the given list.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    static final String META_KIND = "kind";
    static final String KIND_NUDGE = "nudge";
    static final String KIND_CONTEXT = "context_update";
    static final String KIND_AUTO_RETRY = "auto_retry";

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(List<Message> messages, String text) {
        messages.add(message(Message.ROLE_USER, text).build());
    }

    @Override
    public void appendAssistantToolCalls(List<Message> messages, String content, List<Message.ToolCall> toolCalls) {
        messages.add(message(Message.ROLE_ASSISTANT, content).toolCalls(List.copyOf(toolCalls)).build());
    }

    @Override
    public void appendAutoRetryCall(List<Message> messages, String note, Message.ToolCall toolCall) {
        messages.add(message(Message.ROLE_ASSISTANT, note)
                .toolCalls(List.of(toolCall))
                .metadata(Map.of(META_KIND, KIND_AUTO_RETRY))
                .build());
    }

    @Override
    public void appendToolResult(List<Message> messages, ToolExecutionOutcome outcome) {
        messages.add(message(Message.ROLE_TOOL, outcome.messageContent())
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .build());
    }

    @Override
    public void appendAssistantText(List<Message> messages, String text) {
        messages.add(message(Message.ROLE_ASSISTANT, text).build());
    }

    @Override
    public void appendSystemNudge(List<Message> messages, String text) {
        messages.add(message(Message.ROLE_SYSTEM, text).metadata(Map.of(META_KIND, KIND_NUDGE)).build());
    }

    @Override
    public void appendSystemContext(List<Message> messages, String text) {
        messages.add(message(Message.ROLE_SYSTEM, text).metadata(Map.of(META_KIND, KIND_CONTEXT)).build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> messages, String finalText) {
        messages.add(message(Message.ROLE_ASSISTANT, finalText).build());
    }

    private Message.MessageBuilder message(String role, String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .timestamp(clock.instant());
    }
}
