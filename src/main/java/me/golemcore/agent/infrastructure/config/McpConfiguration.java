package me.golemcore.agent.infrastructure.config;

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
import me.golemcore.agent.adapter.outbound.mcp.McpClient;
import me.golemcore.agent.adapter.outbound.mcp.StdioProtocolBridge;
import me.golemcore.agent.port.outbound.ProtocolBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Wires the MCP transport selected by {@code agent.mcp.transport} and the
 * client on top of it.
 *
 * <p>
 * Missing credentials or commands abort startup with
 * {@link IllegalStateException} before any session begins.
 */
@Configuration
@Slf4j
public class McpConfiguration {

    static final String TRANSPORT_HTTP = "http";
    static final String TRANSPORT_STDIO = "stdio";

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "chat", matchIfMissing = true)
    public ProtocolBridge protocolBridge(AgentProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper) {
        AgentProperties.McpProperties mcp = properties.getMcp();
        Duration timeout = Duration.ofSeconds(mcp.getTimeoutSeconds());
        String transport = mcp.getTransport() != null ? mcp.getTransport().trim().toLowerCase() : TRANSPORT_HTTP;

        return switch (transport) {
        case TRANSPORT_HTTP -> {
            requireApiKey(mcp);
            yield new HttpProtocolBridge(okHttpClient, objectMapper, mcp.endpoint(), mcp.getApiKey(), timeout);
        }
        case TRANSPORT_STDIO -> {
            if (mcp.getCommand() == null || mcp.getCommand().isBlank()) {
                throw new IllegalStateException("agent.mcp.command is required for the stdio transport");
            }
            try {
                yield StdioProtocolBridge.launch(mcp.getCommand(), mcp.getEnv(), objectMapper, timeout);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start MCP server: " + mcp.getCommand(), e);
            }
        }
        default -> throw new IllegalStateException(
                "Unsupported agent.mcp.transport '" + mcp.getTransport() + "' (expected http or stdio)");
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "chat", matchIfMissing = true)
    public McpClient mcpClient(ProtocolBridge protocolBridge, ObjectMapper objectMapper,
            AgentProperties properties) {
        AgentProperties.McpProperties mcp = properties.getMcp();
        return new McpClient(protocolBridge, objectMapper, mcp.getClientName(), mcp.getClientVersion());
    }

    /**
     * HTTP transport used by the stdio relay; shares endpoint and credential with
     * the client but has its own, longer timeout.
     */
    @Bean
    @ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "relay")
    public HttpProtocolBridge relayBridge(AgentProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper) {
        AgentProperties.McpProperties mcp = properties.getMcp();
        requireApiKey(mcp);
        log.info("[Relay] Forwarding to {}", mcp.endpoint());
        return new HttpProtocolBridge(okHttpClient, objectMapper, mcp.endpoint(), mcp.getApiKey(),
                Duration.ofSeconds(properties.getRelay().getTimeoutSeconds()));
    }

    private static void requireApiKey(AgentProperties.McpProperties mcp) {
        if (mcp.getApiKey() == null || mcp.getApiKey().isBlank()) {
            throw new IllegalStateException("agent.mcp.api-key is required for the http transport");
        }
        if (mcp.getUrl() == null || mcp.getUrl().isBlank()) {
            throw new IllegalStateException("agent.mcp.url is required for the http transport");
        }
    }
}
