package me.golemcore.logai.infrastructure.config;

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

import me.golemcore.logai.domain.exception.ConfigurationException;
import me.golemcore.logai.domain.model.ModelSelection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks {@link LogAiProperties} ranges once at startup and reports every
 * violation in a single {@link ConfigurationException}.
 */
public final class ConfigurationValidator {

    private static final Set<String> PROVIDERS = Set.of(ModelSelection.PROVIDER_OPENAI,
            ModelSelection.PROVIDER_ANTHROPIC, ModelSelection.PROVIDER_OLLAMA);

    private ConfigurationValidator() {
    }

    public static void validate(LogAiProperties properties) {
        List<String> errors = new ArrayList<>();

        LogAiProperties.AgentProperties agent = properties.getAgent();
        check(errors, agent.getMaxRetryAttempts() >= 0 && agent.getMaxRetryAttempts() <= 5,
                "logai.agent.max-retry-attempts must be between 0 and 5");
        check(errors, agent.getTimeExpansionFactor() > 1.0 && agent.getTimeExpansionFactor() <= 10.0,
                "logai.agent.time-expansion-factor must be greater than 1 and at most 10");
        check(errors, agent.getMaxToolIterations() >= 1 && agent.getMaxToolIterations() <= 100,
                "logai.agent.max-tool-iterations must be between 1 and 100");
        check(errors, agent.getIntentConfidenceThreshold() >= 0.0 && agent.getIntentConfidenceThreshold() <= 1.0,
                "logai.agent.intent-confidence-threshold must be between 0 and 1");

        LogAiProperties.CacheProperties cache = properties.getCache();
        check(errors, cache.getCapacityBytes() > 0, "logai.cache.capacity-bytes must be positive");
        check(errors, cache.getTtl() != null && !cache.getTtl().isNegative() && !cache.getTtl().isZero(),
                "logai.cache.ttl must be positive");
        check(errors, cache.getRecencyFloor() != null && !cache.getRecencyFloor().isNegative(),
                "logai.cache.recency-floor must not be negative");
        check(errors, cache.getHistoricalAge() != null && !cache.getHistoricalAge().isNegative(),
                "logai.cache.historical-age must not be negative");
        check(errors, !cache.isEnabled() || (cache.getDirectory() != null && !cache.getDirectory().isBlank()),
                "logai.cache.directory is required when the cache is enabled");

        LogAiProperties.ToolsProperties tools = properties.getTools();
        check(errors, tools.getMaxItemsPerCall() >= 1 && tools.getMaxItemsPerCall() <= tools.getMaxItemsLimit(),
                "logai.tools.max-items-per-call must be between 1 and logai.tools.max-items-limit");
        check(errors, tools.getMaxLogGroups() >= 1 && tools.getMaxLogGroups() <= tools.getMaxLogGroupsLimit(),
                "logai.tools.max-log-groups must be between 1 and logai.tools.max-log-groups-limit");
        check(errors, tools.getFanOutParallelism() >= 1, "logai.tools.fan-out-parallelism must be positive");
        check(errors, tools.getRateLimit().getMaxAttempts() >= 1,
                "logai.tools.rate-limit.max-attempts must be at least 1");

        LogAiProperties.LlmProperties llm = properties.getLlm();
        String provider = llm.getProvider() != null ? llm.getProvider().trim().toLowerCase(Locale.ROOT)
                : null;
        check(errors, provider != null && PROVIDERS.contains(provider),
                "logai.llm.provider must be one of " + PROVIDERS);
        check(errors, llm.getModel() != null && !llm.getModel().isBlank(), "logai.llm.model is required");
        check(errors, llm.getTemperature() == null || (llm.getTemperature() >= 0.0 && llm.getTemperature() <= 2.0),
                "logai.llm.temperature must be between 0 and 2");
        check(errors, llm.getMaxTokens() > 0, "logai.llm.max-tokens must be positive");

        check(errors, properties.getAws().getRegion() != null && !properties.getAws().getRegion().isBlank(),
                "logai.aws.region is required");

        LogAiProperties.CatalogProperties catalog = properties.getCatalog();
        check(errors, catalog.getMaxGroups() >= 1, "logai.catalog.max-groups must be positive");
        check(errors, catalog.getFullListThreshold() >= 0, "logai.catalog.full-list-threshold must not be negative");

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration:\n- " + String.join("\n- ", errors));
        }
    }

    private static void check(List<String> errors, boolean condition, String message) {
        if (!condition) {
            errors.add(message);
        }
    }
}
