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

import io.micrometer.core.instrument.MeterRegistry;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.service.IntentDetector;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.domain.service.SystemPromptBuilder;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPortFactory;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.tools.ToolCatalog;

import java.time.Clock;

/**
 * Creates one orchestrator per conversation, bound to the model selection the
 * conversation was opened with.
 */
public class TurnOrchestratorFactory {

    private final LlmPortFactory llmPortFactory;
    private final ToolCatalog toolCatalog;
    private final ResultCachePort cache;
    private final RequestCanonicalizer canonicalizer;
    private final HistoryWriter historyWriter;
    private final SystemPromptBuilder promptBuilder;
    private final IntentDetector intentDetector;
    private final EmptyResultRetryPolicy retryPolicy;
    private final LogAiProperties.AgentProperties settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public TurnOrchestratorFactory(LlmPortFactory llmPortFactory, ToolCatalog toolCatalog, ResultCachePort cache,
            RequestCanonicalizer canonicalizer, HistoryWriter historyWriter, SystemPromptBuilder promptBuilder,
            IntentDetector intentDetector, EmptyResultRetryPolicy retryPolicy,
            LogAiProperties.AgentProperties settings, Clock clock, MeterRegistry meterRegistry) {
        this.llmPortFactory = llmPortFactory;
        this.toolCatalog = toolCatalog;
        this.cache = cache;
        this.canonicalizer = canonicalizer;
        this.historyWriter = historyWriter;
        this.promptBuilder = promptBuilder;
        this.intentDetector = intentDetector;
        this.retryPolicy = retryPolicy;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public TurnOrchestrator create(String conversationId, ModelSelection selection) {
        return new DefaultTurnOrchestrator(conversationId, llmPortFactory.create(selection), selection, toolCatalog,
                cache, canonicalizer, historyWriter, promptBuilder, intentDetector, retryPolicy, settings, clock,
                new ToolLoopMetrics(meterRegistry, conversationId));
    }
}
