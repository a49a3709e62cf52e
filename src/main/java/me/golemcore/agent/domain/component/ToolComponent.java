package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executable tool served by the local MCP server. Tools expose their JSON
 * Schema definition through {@code tools/list} and implement the execution
 * logic invoked by {@code tools/call}.
 */
public interface ToolComponent extends Component {

    String CATEGORY_OTHER = "other";

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified arguments. Expected failures (bad
     * input) complete normally with a failed {@link ToolResult}.
     *
     * @param parameters
     *            the call arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Category used by tool search (utilities, api, file-system, ...).
     */
    default String getCategory() {
        return CATEGORY_OTHER;
    }

    default String getToolName() {
        return getDefinition().getName();
    }
}
