package me.golemcore.agent.tools;

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
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Keyword search over the local tool registry; the server side of the
 * bootstrap {@code tool_search} tool.
 *
 * <p>
 * Query tokens are matched against name, category and description tokens
 * (weighted 3, 2 and 1). Tokens sharing a prefix of four or more characters
 * count as a match ({@code calculate} finds {@code calculator}). The result
 * text is
 *
 * <pre>
 * {"query": "...", "total_found": n, "tools": [{"name", "description", "inputSchema",
 *   "inputExamples"?, "_metadata": {"category", "score"}}]}
 * </pre>
 */
@Slf4j
public class ToolSearchTool implements ToolComponent {

    private static final int NAME_WEIGHT = 3;
    private static final int CATEGORY_WEIGHT = 2;
    private static final int DESCRIPTION_WEIGHT = 1;
    private static final int MIN_SHARED_PREFIX = 4;
    private static final int MAX_RESULTS_LIMIT = 50;

    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;
    private final int defaultMaxResults;

    public ToolSearchTool(ToolRegistry registry, ObjectMapper objectMapper, int defaultMaxResults) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.defaultMaxResults = defaultMaxResults;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolContext.bootstrapDescriptor();
    }

    @Override
    public String getCategory() {
        return "search";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object queryValue = parameters.get("query");
        if (!(queryValue instanceof String query) || query.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: query"));
        }
        Object categoryValue = parameters.get("category");
        String category = categoryValue instanceof String text && !text.isBlank()
                ? text.trim().toLowerCase(Locale.ROOT)
                : null;
        int maxResults = parseMaxResults(parameters.get("max_results"));

        List<Match> matches = search(query, category);
        List<Map<String, Object>> found = matches.stream()
                .limit(maxResults)
                .map(ToolSearchTool::toDescriptor)
                .toList();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("total_found", matches.size());
        payload.put("tools", found);
        try {
            log.debug("[ToolSearch] '{}' matched {} tool(s)", query, matches.size());
            return CompletableFuture.completedFuture(
                    ToolResult.success(objectMapper.writeValueAsString(payload), payload));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    List<Match> search(String query, String category) {
        Set<String> queryTokens = tokenize(query);
        List<Match> matches = new ArrayList<>();
        for (ToolComponent tool : registry.all()) {
            if (ToolContext.BOOTSTRAP_TOOL_NAME.equals(tool.getToolName())) {
                continue;
            }
            if (category != null && !category.equals(tool.getCategory())) {
                continue;
            }
            ToolDefinition definition = tool.getDefinition();
            int score = score(queryTokens, tokenize(definition.getName()), NAME_WEIGHT)
                    + score(queryTokens, tokenize(tool.getCategory()), CATEGORY_WEIGHT)
                    + score(queryTokens, tokenize(definition.getDescription()), DESCRIPTION_WEIGHT);
            if (score > 0) {
                matches.add(new Match(tool, score));
            }
        }
        matches.sort(Comparator.comparingInt(Match::score).reversed()
                .thenComparing(m -> m.tool().getToolName()));
        return matches;
    }

    private int parseMaxResults(Object value) {
        int max = defaultMaxResults;
        if (value instanceof Number number) {
            max = number.intValue();
        } else if (value instanceof String text) {
            try {
                max = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                log.debug("[ToolSearch] Ignoring invalid max_results: {}", text);
            }
        }
        return Math.max(1, Math.min(max, MAX_RESULTS_LIMIT));
    }

    private static int score(Set<String> queryTokens, Set<String> targetTokens, int weight) {
        int score = 0;
        for (String q : queryTokens) {
            if (targetTokens.stream().anyMatch(t -> tokensMatch(q, t))) {
                score += weight;
            }
        }
        return score;
    }

    private static boolean tokensMatch(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        int shared = 0;
        int limit = Math.min(a.length(), b.length());
        while (shared < limit && a.charAt(shared) == b.charAt(shared)) {
            shared++;
        }
        return shared >= MIN_SHARED_PREFIX && shared >= limit - 3;
    }

    private static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> token.length() > 1)
                .collect(Collectors.toSet());
    }

    private static Map<String, Object> toDescriptor(Match match) {
        ToolDefinition definition = match.tool().getDefinition();
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", definition.getName());
        descriptor.put("description", definition.getDescription());
        descriptor.put("inputSchema",
                definition.getInputSchema() != null ? definition.getInputSchema() : ToolDefinition.emptySchema());
        if (definition.getInputExamples() != null && !definition.getInputExamples().isEmpty()) {
            descriptor.put("inputExamples", definition.getInputExamples());
        }
        descriptor.put("_metadata", Map.of(
                "category", match.tool().getCategory(),
                "score", match.score()));
        return descriptor;
    }

    record Match(ToolComponent tool, int score) {
    }
}
