package me.golemcore.logai.tools;

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
import me.golemcore.logai.domain.component.ToolComponent;
import me.golemcore.logai.domain.exception.ConfigurationException;
import me.golemcore.logai.domain.model.ToolDefinition;
import me.golemcore.logai.domain.model.ToolKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves tool names requested by the model to their handlers. Built once at
 * startup; every {@link ToolKind} must have exactly one handler.
 */
@Component
@Slf4j
public class ToolCatalog {

    private final Map<ToolKind, ToolComponent> handlers = new EnumMap<>(ToolKind.class);

    public ToolCatalog(List<ToolComponent> tools) {
        for (ToolComponent tool : tools) {
            ToolComponent previous = handlers.put(tool.getKind(), tool);
            if (previous != null) {
                throw new ConfigurationException("Duplicate handler for tool " + tool.getToolName() + ": "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
        }
        for (ToolKind kind : ToolKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new ConfigurationException("No handler registered for tool " + kind.getToolName());
            }
        }
        log.info("[ToolLoop] Registered tools: {}", handlers.keySet());
    }

    public ToolComponent get(ToolKind kind) {
        return handlers.get(kind);
    }

    /**
     * Resolves a tool name as sent by the model.
     */
    public Optional<ToolComponent> resolve(String toolName) {
        return ToolKind.fromToolName(toolName).map(handlers::get);
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(handlers.size());
        for (ToolComponent tool : handlers.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }
}
