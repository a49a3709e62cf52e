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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads raw tool descriptors out of a {@code tool_search} result text.
 *
 * <p>
 * Accepts {@code {"tools":[...]}} or a bare array. When the text holds several
 * JSON documents (one per content block, newline separated) each line is tried
 * on its own. Anything unreadable yields no descriptors rather than an error.
 */
@Slf4j
public class ToolSearchResultParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ToolSearchResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<Map<String, Object>> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        JsonNode whole = readTree(text);
        if (whole != null) {
            return extract(whole);
        }

        List<Map<String, Object>> descriptors = new ArrayList<>();
        for (String line : text.split("\n")) {
            JsonNode node = readTree(line);
            if (node != null) {
                descriptors.addAll(extract(node));
            }
        }
        return descriptors;
    }

    private JsonNode readTree(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return strictReader.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("[ToolSearch] Result is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private List<Map<String, Object>> extract(JsonNode node) {
        JsonNode tools = node.isArray() ? node : node.get("tools");
        if (tools == null || !tools.isArray()) {
            return List.of();
        }
        List<Map<String, Object>> descriptors = new ArrayList<>();
        for (JsonNode tool : tools) {
            if (tool.isObject()) {
                descriptors.add(objectMapper.convertValue(tool, MAP_TYPE_REF));
            }
        }
        return descriptors;
    }
}
