package me.golemcore.agent.port.outbound;

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
import me.golemcore.agent.domain.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * MCP method surface consumed by the orchestrator.
 */
public interface McpPort {

    /**
     * Performs the {@code initialize} handshake and returns the server identity.
     */
    McpServerInfo initialize() throws McpException;

    /**
     * Lists every tool the server exposes (diagnostic listing, not the context).
     */
    List<ToolDefinition> listTools() throws McpException;

    /**
     * Calls a tool and normalizes its content blocks into a {@link ToolResult}.
     * A tool that reports {@code isError} yields a failed result, not an
     * exception.
     */
    ToolResult callTool(String name, Map<String, Object> arguments) throws McpException;

    /**
     * Checks if the server is responsive. Never throws.
     */
    boolean ping();
}
