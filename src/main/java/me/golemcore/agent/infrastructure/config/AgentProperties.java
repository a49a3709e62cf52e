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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link McpProperties} - MCP transport selection and credentials</li>
 * <li>{@link RelayProperties} - stdio-to-HTTP relay</li>
 * <li>{@link LlmProperties} - OpenAI-compatible chat endpoint</li>
 * <li>{@link ToolLoopProperties} - turn ceiling</li>
 * <li>{@link ToolSearchProperties} - local tool search</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /**
     * Startup mode: {@code chat} (interactive session), {@code relay} (stdio to
     * HTTP MCP relay) or {@code serve} (local MCP tool server on stdio).
     */
    private String mode = "chat";

    private McpProperties mcp = new McpProperties();
    private RelayProperties relay = new RelayProperties();
    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private ToolSearchProperties toolSearch = new ToolSearchProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class McpProperties {
        /** {@code http} or {@code stdio}. */
        private String transport = "http";
        private String url = "http://localhost:8080";
        private String path = "/mcp";
        private String apiKey;
        private int timeoutSeconds = 30;
        private String command;
        private Map<String, String> env = new HashMap<>();
        private String clientName = "golemcore-agent";
        private String clientVersion = "1.0.0";

        /**
         * Full endpoint: base URL without trailing slashes plus the path.
         */
        public String endpoint() {
            if (url == null) {
                return null;
            }
            String base = url.replaceAll("/+$", "");
            String suffix = path == null || path.isBlank() ? "" : (path.startsWith("/") ? path : "/" + path);
            return base + suffix;
        }
    }

    @Data
    public static class RelayProperties {
        private int timeoutSeconds = 60;
    }

    @Data
    public static class LlmProperties {
        private String baseUrl = "http://localhost:8080/v1";
        private String apiKey;
        private String model = "openai/gpt-4.1";
        private double temperature = 0.7;
        private Integer maxTokens;
        private String systemPrompt;
    }

    @Data
    public static class ToolLoopProperties {
        /** Maximum number of model calls inside one user turn. */
        private int maxLlmCalls = 10;
    }

    @Data
    public static class ToolSearchProperties {
        private int defaultMaxResults = 5;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
