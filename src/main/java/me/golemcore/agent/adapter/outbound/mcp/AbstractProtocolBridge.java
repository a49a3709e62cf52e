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

import me.golemcore.agent.port.outbound.McpErrorCodes;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.ProtocolBridge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport-independent half of a {@link ProtocolBridge}: request ids, request
 * envelopes and decoding of the response envelope. Subclasses only move one
 * serialized envelope to the server and bring one response back.
 */
public abstract class AbstractProtocolBridge implements ProtocolBridge {

    private static final Logger log = LoggerFactory.getLogger(AbstractProtocolBridge.class);

    public static final String JSONRPC_VERSION = "2.0";

    protected final ObjectMapper objectMapper;
    private final AtomicInteger nextId = new AtomicInteger(1);

    protected AbstractProtocolBridge(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode send(String method, Map<String, Object> params) throws McpException {
        int id = nextId.getAndIncrement();
        ObjectNode request = buildRequest(id, method, params);
        log.debug("[MCP:{}] → {} (id={})", transportName(), method, id);

        JsonNode response = exchange(id, request);
        return extractResult(method, response);
    }

    /**
     * Delivers the request envelope and returns the matching response envelope.
     */
    protected abstract JsonNode exchange(int id, ObjectNode request) throws McpException;

    protected ObjectNode buildRequest(int id, String method, Map<String, Object> params) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        if (params != null && !params.isEmpty()) {
            request.set("params", objectMapper.valueToTree(params));
        }
        return request;
    }

    protected String serialize(JsonNode envelope) throws McpException {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new McpException(McpErrorCodes.INTERNAL_ERROR, "Failed to serialize request: " + e.getMessage(), e);
        }
    }

    private JsonNode extractResult(String method, JsonNode response) throws McpException {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt(McpErrorCodes.INTERNAL_ERROR);
            String message = error.path("message").asText("Unknown error");
            log.debug("[MCP:{}] ← {} error {}: {}", transportName(), method, code, message);
            throw new McpException(code, message);
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            return objectMapper.createObjectNode();
        }
        return result;
    }
}
