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

import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolLoopStats;
import me.golemcore.logai.domain.model.TurnResult;
import me.golemcore.logai.domain.model.TurnState;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Runs the model to tools to model loop of one conversation. At most one turn
 * runs at a time; {@link #cancelTurn()} may be called from any thread.
 */
public interface TurnOrchestrator {

    String getConversationId();

    /**
     * Processes one user utterance until a terminal outcome. A second concurrent
     * call is rejected with {@link TurnResult#TURN_IN_PROGRESS}.
     */
    TurnResult processTurn(String utterance);

    /**
     * Cancels the running turn, if any. The turn leaves no trace of the
     * interrupted step in history or cache.
     */
    void cancelTurn();

    TurnState getState();

    /**
     * Text fragments of model output as they arrive, followed by synthesized
     * explanations.
     */
    Flux<String> answerFragments();

    Flux<ToolCallRecord> toolCallRecords();

    List<ToolCallRecord> toolCallSnapshot();

    List<Message> history();

    void clearHistory();

    /**
     * Queues a system message for the next model call of this conversation.
     */
    void injectContextUpdate(String text);

    CacheStats cacheStats();

    /**
     * Retry, nudge and cap counters of this conversation.
     */
    ToolLoopStats toolLoopStats();
}
