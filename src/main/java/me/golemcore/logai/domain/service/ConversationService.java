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
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.system.toolloop.TurnOrchestrator;
import me.golemcore.logai.domain.system.toolloop.TurnOrchestratorFactory;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of open conversations. Each conversation owns its orchestrator and
 * history; the cache and the log group catalog are shared.
 */
@Service
@Slf4j
public class ConversationService {

    private final TurnOrchestratorFactory orchestratorFactory;
    private final LogGroupCatalogService catalog;
    private final LogAiProperties.LlmProperties llmSettings;
    private final Map<String, TurnOrchestrator> conversations = new ConcurrentHashMap<>();

    public ConversationService(TurnOrchestratorFactory orchestratorFactory, LogGroupCatalogService catalog,
            LogAiProperties properties) {
        this.orchestratorFactory = orchestratorFactory;
        this.catalog = catalog;
        this.llmSettings = properties.getLlm();
    }

    public ModelSelection defaultSelection() {
        return new ModelSelection(llmSettings.getProvider(), llmSettings.getModel(), llmSettings.getTemperature());
    }

    public TurnOrchestrator open() {
        return open(defaultSelection());
    }

    public TurnOrchestrator open(ModelSelection selection) {
        String id = UUID.randomUUID().toString();
        TurnOrchestrator orchestrator = orchestratorFactory.create(id, selection);
        conversations.put(id, orchestrator);
        log.info("[Conversation] Opened {} with {}/{}", id, selection.provider(), selection.model());
        return orchestrator;
    }

    public Optional<TurnOrchestrator> get(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    public Collection<TurnOrchestrator> all() {
        return List.copyOf(conversations.values());
    }

    /**
     * Cancels any running turn and forgets the conversation.
     */
    public void close(String conversationId) {
        TurnOrchestrator orchestrator = conversations.remove(conversationId);
        if (orchestrator != null) {
            orchestrator.cancelTurn();
            log.info("[Conversation] Closed {}", conversationId);
        }
    }

    /**
     * Reloads the log group catalog and hands the new listing to every open
     * conversation once.
     *
     * @return number of log groups now in the catalog
     */
    public int refreshCatalog() {
        String update = catalog.refresh();
        conversations.values().forEach(orchestrator -> orchestrator.injectContextUpdate(update));
        return catalog.groups().size();
    }
}
