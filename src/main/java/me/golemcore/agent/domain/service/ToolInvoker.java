package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Executes a single tool call through the MCP port, guarded by the session's
 * tool context.
 *
 * <p>
 * The returned {@link ToolResult} holds the newline-joined text blocks of the
 * response. A tool that reports {@code isError} yields a failed result whose
 * text is still present.
 */
@Slf4j
public class ToolInvoker {

    private final McpPort mcpPort;

    public ToolInvoker(McpPort mcpPort) {
        this.mcpPort = mcpPort;
    }

    public ToolResult invoke(ToolContext toolContext, String name, Map<String, Object> arguments)
            throws ToolNotInContextException, McpException {
        if (!toolContext.contains(name)) {
            throw new ToolNotInContextException(name);
        }
        log.debug("[ToolInvoker] Calling {} with {} argument(s)", name, arguments != null ? arguments.size() : 0);
        return mcpPort.callTool(name, arguments != null ? arguments : Map.of());
    }
}
