package me.golemcore.agent.adapter.outbound.mcp;

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

import me.golemcore.agent.domain.model.McpServerInfo;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.McpErrorCodes;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ProtocolBridge;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP client on top of a {@link ProtocolBridge}.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@link #initialize()} (JSON-RPC handshake, records server identity)
 * <li>{@link #listTools()} / {@link #callTool(String, Map)} / {@link #ping()}
 * <li>{@link #close()} releases the underlying transport
 * </ol>
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean by itself; built by
 * {@link me.golemcore.agent.infrastructure.config.McpConfiguration} around the
 * transport selected in configuration.
 */
public class McpClient implements McpPort, Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    public static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> LIST_TYPE_REF = new TypeReference<>() {
    };

    private final ProtocolBridge bridge;
    private final ObjectMapper objectMapper;
    private final String clientName;
    private final String clientVersion;

    private McpServerInfo serverInfo;

    public McpClient(ProtocolBridge bridge, ObjectMapper objectMapper, String clientName, String clientVersion) {
        this.bridge = bridge;
        this.objectMapper = objectMapper;
        this.clientName = clientName;
        this.clientVersion = clientVersion;
    }

    @Override
    public McpServerInfo initialize() throws McpException {
        JsonNode result = bridge.send("initialize", Map.of(
                "protocolVersion", MCP_PROTOCOL_VERSION,
                "capabilities", Map.of("tools", Map.of()),
                "clientInfo", Map.of(
                        "name", clientName,
                        "version", clientVersion)));

        JsonNode info = result.path("serverInfo");
        Map<String, Object> capabilities = result.has("capabilities")
                ? objectMapper.convertValue(result.get("capabilities"), MAP_TYPE_REF)
                : Map.of();
        serverInfo = McpServerInfo.builder()
                .name(info.path("name").asText("Unknown"))
                .version(info.path("version").asText("Unknown"))
                .protocolVersion(result.path("protocolVersion").asText(MCP_PROTOCOL_VERSION))
                .capabilities(capabilities)
                .build();
        log.info("[MCP:{}] Initialized: {} {}", bridge.transportName(), serverInfo.getName(),
                serverInfo.getVersion());
        return serverInfo;
    }

    @Override
    public List<ToolDefinition> listTools() throws McpException {
        requireInitialized();
        JsonNode result = bridge.send("tools/list", null);
        List<ToolDefinition> tools = parseToolDefinitions(result);
        log.debug("[MCP:{}] Server tools: {}", bridge.transportName(),
                tools.stream().map(ToolDefinition::getName).toList());
        return tools;
    }

    @Override
    public ToolResult callTool(String name, Map<String, Object> arguments) throws McpException {
        requireInitialized();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        JsonNode result = bridge.send("tools/call", params);
        return parseToolCallResult(name, result);
    }

    @Override
    public boolean ping() {
        try {
            bridge.send("ping", null);
            return true;
        } catch (McpException e) {
            log.debug("[MCP:{}] Ping failed: {}", bridge.transportName(), e.getMessage());
            return false;
        }
    }

    public McpServerInfo getServerInfo() {
        return serverInfo != null ? serverInfo : McpServerInfo.unknown();
    }

    public boolean isInitialized() {
        return serverInfo != null;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", bridge.transportName());
        bridge.close();
    }

    private void requireInitialized() throws McpException {
        if (serverInfo == null) {
            throw new McpException(McpErrorCodes.INVALID_REQUEST, "Must call initialize() first");
        }
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        JsonNode toolsNode = result != null ? result.get("tools") : null;
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.hasNonNull("name") ? toolNode.get("name").asText() : null;
            if (name == null || name.isBlank()) {
                continue;
            }

            Map<String, Object> inputSchema = ToolDefinition.emptySchema();
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", bridge.transportName(),
                            name, e.getMessage());
                }
            }
            List<Map<String, Object>> examples = null;
            if (toolNode.has("inputExamples") && toolNode.get("inputExamples").isArray()) {
                examples = objectMapper.convertValue(toolNode.get("inputExamples"), LIST_TYPE_REF);
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(toolNode.path("description").asText(""))
                    .inputSchema(inputSchema)
                    .inputExamples(examples)
                    .build());
        }
        return tools;
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.TOOL_ERROR, "No result from MCP tool: " + toolName);
        }

        boolean isError = result.path("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.path("type").asText("text");
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(ToolFailureKind.TOOL_ERROR,
                    output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }
}
