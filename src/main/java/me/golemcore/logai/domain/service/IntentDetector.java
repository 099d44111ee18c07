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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logai.domain.model.DetectedIntent;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Detects responses in which the model announces a retrieval ("Let me search
 * the logs...") instead of calling a tool.
 */
@Component
@Slf4j
public class IntentDetector {

    private final IntentRuleSet ruleSet;
    private final double threshold;

    @Autowired
    public IntentDetector(IntentRuleSet ruleSet, LogAiProperties properties) {
        this(ruleSet, properties.getAgent().getIntentConfidenceThreshold());
    }

    public IntentDetector(IntentRuleSet ruleSet, double threshold) {
        this.ruleSet = ruleSet;
        this.threshold = threshold;
    }

    /**
     * Returns the strongest actionable intention at or above the confidence
     * threshold.
     */
    public Optional<DetectedIntent> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        DetectedIntent best = null;
        for (IntentRule rule : ruleSet.rules()) {
            if (!rule.actionable() || rule.confidence() < threshold) {
                continue;
            }
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find() && (best == null || rule.confidence() > best.confidence())) {
                best = new DetectedIntent(rule.type(), rule.confidence(), matcher.group(), rule.suggestedAction());
            }
        }
        if (best != null) {
            log.debug("[ToolLoop] Detected unexecuted intent {} ({})", best.type(), best.confidence());
        }
        return Optional.ofNullable(best);
    }
}
