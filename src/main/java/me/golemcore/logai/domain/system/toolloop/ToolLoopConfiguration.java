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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.logai.domain.service.IntentDetector;
import me.golemcore.logai.domain.service.IntentRuleSet;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.domain.service.SystemPromptBuilder;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPortFactory;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.tools.ToolCatalog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the turn orchestrator (domain loop + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentRuleSet intentRuleSet() {
        return IntentRuleSet.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public EmptyResultRetryPolicy emptyResultRetryPolicy(LogAiProperties properties) {
        return new EmptyResultRetryPolicy(properties.getAgent());
    }

    @Bean
    public TurnOrchestratorFactory turnOrchestratorFactory(LlmPortFactory llmPortFactory, ToolCatalog toolCatalog,
            ResultCachePort cache, RequestCanonicalizer canonicalizer, HistoryWriter historyWriter,
            SystemPromptBuilder promptBuilder, IntentDetector intentDetector, EmptyResultRetryPolicy retryPolicy,
            LogAiProperties properties, Clock clock, MeterRegistry meterRegistry) {
        return new TurnOrchestratorFactory(llmPortFactory, toolCatalog, cache, canonicalizer, historyWriter,
                promptBuilder, intentDetector, retryPolicy, properties.getAgent(), clock, meterRegistry);
    }
}
