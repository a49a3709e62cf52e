package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.tools.ToolSearchTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name → handler registry of the tools served by the local MCP server.
 *
 * <p>
 * Populated once at startup with every enabled {@link ToolComponent} bean plus
 * the {@code tool_search} tool, which searches this registry.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolRegistry(List<ToolComponent> components, AgentProperties properties, ObjectMapper objectMapper) {
        register(new ToolSearchTool(this, objectMapper, properties.getToolSearch().getDefaultMaxResults()));
        for (ToolComponent component : components) {
            register(component);
        }
        log.debug("[Tools] Registered: {}", tools.keySet());
    }

    public final void register(ToolComponent tool) {
        if (!tool.isEnabled()) {
            log.debug("[Tools] Skipping disabled tool {}", tool.getToolName());
            return;
        }
        ToolComponent previous = tools.putIfAbsent(tool.getToolName(), tool);
        if (previous != null) {
            log.warn("[Tools] Duplicate tool name {}, keeping the first registration", tool.getToolName());
        }
    }

    public Optional<ToolComponent> find(String name) {
        return Optional.ofNullable(name != null ? tools.get(name) : null);
    }

    public List<ToolComponent> all() {
        return new ArrayList<>(tools.values());
    }
}
