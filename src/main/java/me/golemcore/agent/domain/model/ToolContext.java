package me.golemcore.agent.domain.model;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the tool descriptors currently offered to the model.
 *
 * <p>
 * The bootstrap {@code tool_search} descriptor is always present and always
 * first. Every other descriptor enters through {@link #mergeDiscovered}, keyed
 * by name, in first-insertion order. Owned by a single session.
 */
public class ToolContext {

    public static final String BOOTSTRAP_TOOL_NAME = "tool_search";

    private static final String PRIVATE_KEY_PREFIX = "_";
    private static final String KEY_NAME = "name";
    private static final String KEY_DESCRIPTION = "description";
    private static final String KEY_INPUT_SCHEMA = "inputSchema";
    private static final String KEY_INPUT_EXAMPLES = "inputExamples";

    private static final ToolDefinition BOOTSTRAP = ToolDefinition.builder()
            .name(BOOTSTRAP_TOOL_NAME)
            .description("Search for tools by natural language query. "
                    + "Returns tool definitions that can be added to context.")
            .inputSchema(Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "query", Map.of(
                                    "type", "string",
                                    "description",
                                    "Natural language description of the capability you're looking for"),
                            "category", Map.of(
                                    "type", "string",
                                    "description",
                                    "Optional category filter (messaging, file-system, database, api, git, "
                                            + "calendar, shell, search, other)"),
                            "max_results", Map.of(
                                    "type", "integer",
                                    "description", "Maximum number of tools to return (default: 5)",
                                    "default", 5)),
                    "required", List.of("query")))
            .build();

    private final Map<String, ToolDefinition> discovered = new LinkedHashMap<>();

    public static ToolDefinition bootstrapDescriptor() {
        return BOOTSTRAP;
    }

    /**
     * Tools to offer the model: bootstrap first, then discovered tools in
     * insertion order.
     */
    public List<ToolDefinition> currentDescriptors() {
        List<ToolDefinition> tools = new ArrayList<>(discovered.size() + 1);
        tools.add(BOOTSTRAP);
        tools.addAll(discovered.values());
        return tools;
    }

    /**
     * Stores every named entry (except the bootstrap name) by name, with keys
     * starting with an underscore removed. Entries without a name are ignored.
     *
     * @return names of the entries that were stored
     */
    public List<String> mergeDiscovered(Collection<Map<String, Object>> rawDescriptors) {
        List<String> merged = new ArrayList<>();
        if (rawDescriptors == null) {
            return merged;
        }
        for (Map<String, Object> raw : rawDescriptors) {
            if (raw == null) {
                continue;
            }
            Object nameValue = raw.get(KEY_NAME);
            if (!(nameValue instanceof String name) || name.isBlank() || BOOTSTRAP_TOOL_NAME.equals(name)) {
                continue;
            }
            discovered.put(name, toDefinition(name, stripPrivateKeys(raw)));
            merged.add(name);
        }
        return merged;
    }

    /**
     * Removes all discovered descriptors; the bootstrap descriptor stays.
     */
    public void clear() {
        discovered.clear();
    }

    public boolean contains(String name) {
        return BOOTSTRAP_TOOL_NAME.equals(name) || discovered.containsKey(name);
    }

    public int size() {
        return discovered.size() + 1;
    }

    private static Map<String, Object> stripPrivateKeys(Map<String, Object> raw) {
        Map<String, Object> clean = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key != null && !key.startsWith(PRIVATE_KEY_PREFIX)) {
                clean.put(key, value);
            }
        });
        return clean;
    }

    @SuppressWarnings("unchecked")
    private static ToolDefinition toDefinition(String name, Map<String, Object> clean) {
        Object description = clean.get(KEY_DESCRIPTION);
        Object schema = clean.get(KEY_INPUT_SCHEMA);
        Object examples = clean.get(KEY_INPUT_EXAMPLES);
        return ToolDefinition.builder()
                .name(name)
                .description(description instanceof String text ? text : "")
                .inputSchema(schema instanceof Map<?, ?> map ? (Map<String, Object>) map
                        : ToolDefinition.emptySchema())
                .inputExamples(examples instanceof List<?> list ? (List<Map<String, Object>>) list : null)
                .build();
    }
}
