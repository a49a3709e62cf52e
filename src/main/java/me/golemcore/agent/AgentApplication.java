package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the tool-augmented MCP agent.
 *
 * <p>
 * One binary, three modes selected by {@code agent.mode}:
 * <ul>
 * <li><b>chat</b> - interactive conversation with an OpenAI-compatible model
 * that discovers MCP tools on demand through {@code tool_search}</li>
 * <li><b>relay</b> - stdio to HTTP bridge for MCP hosts that only speak
 * stdio</li>
 * <li><b>serve</b> - local MCP tool server on stdio (calculator, echo,
 * datetime, tool_search)</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → InteractiveSession, McpStdioRelay, LocalToolServer
 * Domain Layer       → ToolLoopSystem, ConversationState, ToolContext, ToolInvoker
 * Infrastructure     → McpClient over HTTP/stdio ProtocolBridge, Feign LLM adapter
 * </pre>
 *
 * <p>
 * Stdout is reserved for the protocol in relay and serve modes; all logging
 * goes to stderr.
 *
 * @since 1.0
 */
@SpringBootApplication
public class AgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
    }
}
