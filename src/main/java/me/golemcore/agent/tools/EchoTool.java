package me.golemcore.agent.tools;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns its input message. Useful for testing connectivity.
 */
@Component
public class EchoTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("echo")
                .description("Simple echo tool that returns the input message. Useful for testing connectivity.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "message", Map.of(
                                        "type", "string",
                                        "description", "Message to echo back")),
                        "required", List.of("message")))
                .build();
    }

    @Override
    public String getCategory() {
        return "utilities";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object message = parameters.get("message");
        if (message == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: message"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(String.valueOf(message)));
    }
}
