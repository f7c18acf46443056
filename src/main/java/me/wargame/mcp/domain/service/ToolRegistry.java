package me.wargame.mcp.domain.service;

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
import me.wargame.mcp.domain.component.ToolComponent;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Fixed registry of the tools exposed to agents, resolved by name at call
 * time. Adding a tool means adding a {@link ToolComponent} bean.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new TreeMap<>();

    public ToolRegistry(List<ToolComponent> components) {
        for (ToolComponent component : components) {
            ToolComponent previous = tools.put(component.getToolName(), component);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + component.getToolName());
            }
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public Optional<ToolComponent> find(String name) {
        ToolComponent tool = name != null ? tools.get(name) : null;
        return tool != null && tool.isEnabled() ? Optional.of(tool) : Optional.empty();
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Map<String, ToolComponent> getTools() {
        return Collections.unmodifiableMap(tools);
    }

    public Optional<ToolSource> sourceOf(String name) {
        return find(name).map(ToolComponent::getSource);
    }

    public CompletableFuture<ToolResult> execute(String name, Map<String, Object> parameters) {
        Optional<ToolComponent> tool = find(name);
        if (tool.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + name));
        }
        return tool.get().execute(parameters);
    }
}
