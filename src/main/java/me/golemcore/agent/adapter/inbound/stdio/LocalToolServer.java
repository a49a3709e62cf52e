package me.golemcore.agent.adapter.inbound.stdio;

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

import me.golemcore.agent.adapter.outbound.mcp.McpClient;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.port.outbound.McpErrorCodes;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Line-oriented MCP server over stdin/stdout, backed by the {@link ToolRegistry}.
 *
 * <p>
 * Methods: {@code initialize}, {@code tools/list}, {@code tools/call},
 * {@code ping}. Unknown methods get {@code -32601}; an exception while handling
 * a request gets {@code -32603}. A failed tool answers normally with
 * {@code isError: true}.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "serve")
@Slf4j
public class LocalToolServer implements CommandLineRunner, JsonRpcLineLoop.Handler {

    public static final String SERVER_NAME = "golemcore-local-tools";
    public static final String SERVER_VERSION = "1.0.0";

    private static final long TOOL_TIMEOUT_SECONDS = 30;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;

    public LocalToolServer(ToolRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        serve(System.in, System.out);
    }

    public void serve(InputStream in, OutputStream out) {
        try (JsonRpcLineLoop loop = new JsonRpcLineLoop("LocalTools", in, out, objectMapper, this)) {
            loop.run();
        }
    }

    @Override
    public JsonNode handle(ObjectNode request) {
        JsonNode id = request.get("id");
        String method = request.path("method").asText("");
        JsonNode params = request.path("params");

        if (id == null || id.isNull()) {
            log.debug("[LocalTools] Notification: {}", method);
            return null;
        }

        try {
            JsonNode result = switch (method) {
            case "initialize" -> initialize(params);
            case "tools/list" -> listTools();
            case "tools/call" -> callTool(params);
            case "ping" -> objectMapper.createObjectNode();
            default -> null;
            };
            if (result == null) {
                return JsonRpcLineLoop.error(objectMapper, id, McpErrorCodes.METHOD_NOT_FOUND,
                        "Method not found: " + method);
            }
            return JsonRpcLineLoop.result(objectMapper, id, result);
        } catch (RuntimeException e) {
            log.warn("[LocalTools] {} failed: {}", method, e.getMessage());
            return JsonRpcLineLoop.error(objectMapper, id, McpErrorCodes.INTERNAL_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private JsonNode initialize(JsonNode params) {
        log.info("[LocalTools] Client connected: {}", params.path("clientInfo").path("name").asText("unknown"));
        ObjectNode result = objectMapper.createObjectNode();
        result.put("protocolVersion", McpClient.MCP_PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools");
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        return result;
    }

    private JsonNode listTools() {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolComponent tool : registry.all()) {
            ToolDefinition definition = tool.getDefinition();
            ObjectNode node = tools.addObject();
            node.put("name", definition.getName());
            node.put("description", definition.getDescription());
            node.set("inputSchema", objectMapper.valueToTree(
                    definition.getInputSchema() != null ? definition.getInputSchema() : ToolDefinition.emptySchema()));
            if (definition.getInputExamples() != null && !definition.getInputExamples().isEmpty()) {
                node.set("inputExamples", objectMapper.valueToTree(definition.getInputExamples()));
            }
        }
        return result;
    }

    private JsonNode callTool(JsonNode params) {
        String name = params.path("name").asText("");
        Map<String, Object> arguments = params.has("arguments") && params.get("arguments").isObject()
                ? objectMapper.convertValue(params.get("arguments"), MAP_TYPE_REF)
                : Map.of();
        log.debug("[LocalTools] Tool call: {}", name);

        Optional<ToolComponent> tool = registry.find(name);
        if (tool.isEmpty()) {
            return toolContent("Unknown tool: " + name, true);
        }
        ToolResult result = execute(tool.get(), arguments);
        return toolContent(result.getOutput() != null ? result.getOutput() : "", !result.isSuccess());
    }

    private ToolResult execute(ToolComponent tool, Map<String, Object> arguments) {
        try {
            return tool.execute(arguments).get(TOOL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + tool.getToolName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException(tool.getToolName() + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            return ToolResult.failure("Tool " + tool.getToolName() + " timed out after " + TOOL_TIMEOUT_SECONDS + "s");
        }
    }

    private ObjectNode toolContent(String text, boolean isError) {
        ObjectNode result = objectMapper.createObjectNode();
        ObjectNode block = result.putArray("content").addObject();
        block.put("type", "text");
        block.put("text", text);
        if (isError) {
            result.put("isError", true);
        }
        return result;
    }
}
