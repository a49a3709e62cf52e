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

import me.golemcore.agent.adapter.outbound.mcp.HttpProtocolBridge;
import me.golemcore.agent.port.outbound.McpException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stdio to HTTP relay for MCP hosts that only speak stdio.
 *
 * <p>
 * Every request line is forwarded unchanged (the host's id included) to the
 * HTTP MCP endpoint and the response envelope is written back as one line.
 * Transport failures become error envelopes with the request's id and the
 * transport error code. Notifications are forwarded but never answered.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "relay")
@Slf4j
public class McpStdioRelay implements CommandLineRunner, JsonRpcLineLoop.Handler {

    private final HttpProtocolBridge bridge;
    private final ObjectMapper objectMapper;

    public McpStdioRelay(HttpProtocolBridge bridge, ObjectMapper objectMapper) {
        this.bridge = bridge;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        serve(System.in, System.out);
    }

    public void serve(InputStream in, OutputStream out) {
        try (JsonRpcLineLoop loop = new JsonRpcLineLoop("Relay", in, out, objectMapper, this)) {
            loop.run();
        }
    }

    @Override
    public JsonNode handle(ObjectNode request) {
        JsonNode id = request.get("id");
        boolean notification = id == null || id.isNull();
        try {
            JsonNode response = bridge.forward(request);
            return notification ? null : response;
        } catch (McpException e) {
            log.warn("[Relay] {} failed ({}): {}", request.path("method").asText("?"), e.getCode(), e.getMessage());
            if (notification) {
                return null;
            }
            return JsonRpcLineLoop.error(objectMapper, id, e.getCode(), e.getMessage());
        }
    }
}
