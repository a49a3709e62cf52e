package me.golemcore.agent.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Result of a tool execution. The output text is kept for failed results too,
 * because it is still written into the conversation as the tool message so the
 * model can react to it.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private ToolFailureKind failureKind;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result reported by the tool itself.
     */
    public static ToolResult failure(String output) {
        return failure(ToolFailureKind.TOOL_ERROR, output);
    }

    /**
     * Creates a failed tool result with an explicit failure kind.
     */
    public static ToolResult failure(ToolFailureKind kind, String output) {
        return ToolResult.builder()
                .success(false)
                .output(output)
                .failureKind(kind)
                .build();
    }

    public boolean isError() {
        return !success;
    }
}
