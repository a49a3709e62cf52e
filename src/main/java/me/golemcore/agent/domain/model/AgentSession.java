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

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * One interactive orchestration session. Owns the conversation log and the tool
 * context; both live for the duration of the session and are never shared.
 */
@Getter
public class AgentSession {

    private final String id;
    private final ConversationState conversation;
    private final ToolContext toolContext;
    private final Instant createdAt;

    public AgentSession(String systemPrompt) {
        this(UUID.randomUUID().toString(), new ConversationState(systemPrompt), new ToolContext(), Instant.now());
    }

    public AgentSession(String id, ConversationState conversation, ToolContext toolContext, Instant createdAt) {
        this.id = id;
        this.conversation = conversation;
        this.toolContext = toolContext;
        this.createdAt = createdAt;
    }
}
