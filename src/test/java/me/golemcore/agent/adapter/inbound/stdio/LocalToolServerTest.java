package me.golemcore.agent.adapter.inbound.stdio;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpErrorCodes;
import me.golemcore.agent.tools.CalculatorTool;
import me.golemcore.agent.tools.EchoTool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalToolServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LocalToolServer server;

    @BeforeEach
    void setUp() {
        ToolComponent broken = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.builder().name("broken").description("Always throws").build();
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.failedFuture(new IllegalStateException("disk on fire"));
            }
        };
        ToolRegistry registry = new ToolRegistry(List.of(new CalculatorTool(), new EchoTool(), broken),
                new AgentProperties(), objectMapper);
        server = new LocalToolServer(registry, objectMapper);
    }

    // ===== Handshake =====

    @Test
    void shouldAnswerInitialize() {
        JsonNode response = server.handle(request(1, "initialize",
                "{\"protocolVersion\":\"2024-11-05\",\"clientInfo\":{\"name\":\"test\"}}"));

        JsonNode result = response.get("result");
        assertEquals("2024-11-05", result.get("protocolVersion").asText());
        assertTrue(result.path("capabilities").has("tools"));
        assertEquals(LocalToolServer.SERVER_NAME, result.path("serverInfo").path("name").asText());
        assertEquals(LocalToolServer.SERVER_VERSION, result.path("serverInfo").path("version").asText());
    }

    @Test
    void shouldAnswerPingWithEmptyObject() {
        JsonNode response = server.handle(request(2, "ping", null));

        assertTrue(response.get("result").isObject());
        assertTrue(response.get("result").isEmpty());
    }

    @Test
    void shouldIgnoreNotifications() {
        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("jsonrpc", "2.0");
        notification.put("method", "notifications/initialized");

        assertNull(server.handle(notification));
    }

    @Test
    void shouldRejectUnknownMethod() {
        JsonNode response = server.handle(request(3, "resources/list", null));

        assertEquals(3, response.get("id").asInt());
        assertEquals(McpErrorCodes.METHOD_NOT_FOUND, response.path("error").path("code").asInt());
        assertEquals("Method not found: resources/list", response.path("error").path("message").asText());
    }

    // ===== tools/list =====

    @Test
    void shouldListRegisteredTools() {
        JsonNode tools = server.handle(request(4, "tools/list", null)).path("result").path("tools");

        assertEquals(4, tools.size());
        assertEquals(ToolContext.BOOTSTRAP_TOOL_NAME, tools.get(0).get("name").asText());
        JsonNode calculator = tools.get(1);
        assertEquals("calculator", calculator.get("name").asText());
        assertEquals("object", calculator.path("inputSchema").path("type").asText());
        assertTrue(calculator.path("inputExamples").isArray());
        assertFalse(tools.get(2).has("inputExamples"));
    }

    // ===== tools/call =====

    @Test
    void shouldCallTool() {
        JsonNode result = server.handle(request(5, "tools/call",
                "{\"name\":\"calculator\",\"arguments\":{\"expression\":\"2+2\"}}")).get("result");

        assertEquals("text", result.path("content").get(0).path("type").asText());
        assertEquals("4", result.path("content").get(0).path("text").asText());
        assertFalse(result.has("isError"));
    }

    @Test
    void shouldFlagToolFailureAsError() {
        JsonNode result = server.handle(request(6, "tools/call",
                "{\"name\":\"calculator\",\"arguments\":{\"expression\":\"1/0\"}}")).get("result");

        assertTrue(result.path("isError").asBoolean());
        assertEquals("Calculation error: Division by zero", result.path("content").get(0).path("text").asText());
    }

    @Test
    void shouldFlagUnknownTool() {
        JsonNode result = server.handle(request(7, "tools/call", "{\"name\":\"weather\"}")).get("result");

        assertTrue(result.path("isError").asBoolean());
        assertEquals("Unknown tool: weather", result.path("content").get(0).path("text").asText());
    }

    @Test
    void shouldAnswerInternalErrorWhenToolThrows() {
        JsonNode response = server.handle(request(8, "tools/call", "{\"name\":\"broken\",\"arguments\":{}}"));

        assertEquals(McpErrorCodes.INTERNAL_ERROR, response.path("error").path("code").asInt());
        assertTrue(response.path("error").path("message").asText().contains("disk on fire"));
    }

    @Test
    void shouldServeSearchThroughBootstrapTool() throws Exception {
        JsonNode result = server.handle(request(9, "tools/call",
                "{\"name\":\"tool_search\",\"arguments\":{\"query\":\"calculate\"}}")).get("result");

        JsonNode payload = objectMapper.readTree(result.path("content").get(0).path("text").asText());
        assertEquals("calculator", payload.path("tools").get(0).path("name").asText());
    }

    // ===== stdio =====

    @Test
    void shouldServeOverLines() throws Exception {
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        server.serve(JsonRpcLineLoopTest.input(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}",
                "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
                "not json",
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\",\"arguments\":{\"message\":\"hi\"}}}"),
                output);

        List<String> lines = JsonRpcLineLoopTest.nonEmptyLines(output);
        assertEquals(3, lines.size());
        assertEquals(1, objectMapper.readTree(lines.get(0)).get("id").asInt());
        assertEquals(McpErrorCodes.PARSE_ERROR, objectMapper.readTree(lines.get(1)).path("error").path("code").asInt());
        JsonNode echo = objectMapper.readTree(lines.get(2));
        assertEquals("hi", echo.path("result").path("content").get(0).path("text").asText());
    }

    private ObjectNode request(int id, String method, String params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", id);
        request.put("method", method);
        if (params != null) {
            try {
                request.set("params", objectMapper.readTree(params));
            } catch (Exception e) {
                throw new IllegalArgumentException(e);
            }
        }
        return request;
    }
}
