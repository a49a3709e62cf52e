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

import java.util.List;
import java.util.Map;

/**
 * Represents a single message in the conversation between user, assistant and
 * tools. The message list is replayed verbatim to the model on every call, so
 * order is significant.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role; // system, user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls; // assistant messages requesting tools
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    /**
     * Checks if this message is from the user.
     */
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this is a system message.
     */
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and parsed JSON arguments (empty when the model sent
     * arguments that could not be parsed).
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
