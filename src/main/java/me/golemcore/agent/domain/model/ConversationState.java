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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered message log of one session.
 *
 * <p>
 * Appends only go to the end. The log can be truncated back to a length
 * captured earlier with {@link #snapshot()}, which is how a failed model call
 * discards a partially applied turn.
 *
 * <p>
 * Invariants enforced on append:
 * <ul>
 * <li>at most one system message, and only as the first message
 * <li>a tool message answers a tool call emitted by the most recent assistant
 * message
 * </ul>
 * Violations raise {@link ConversationStateException}.
 *
 * <p>
 * Not thread-safe: owned by one session and mutated only by its tool loop.
 */
public class ConversationState {

    private final List<Message> messages = new ArrayList<>();

    public ConversationState() {
    }

    public ConversationState(String systemPrompt) {
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Message.system(systemPrompt));
        }
    }

    public void append(Message message) {
        Objects.requireNonNull(message, "message");
        if (message.isSystemMessage() && !messages.isEmpty()) {
            throw new ConversationStateException("System message must be the first and only system message");
        }
        if (message.isToolMessage()) {
            requireMatchingToolCall(message.getToolCallId());
        }
        messages.add(message);
    }

    /**
     * Captures the current log length for a later {@link #rollback(int)}.
     */
    public int snapshot() {
        return messages.size();
    }

    /**
     * Truncates the log back to a length returned by {@link #snapshot()}.
     */
    public void rollback(int snapshot) {
        if (snapshot < 0 || snapshot > messages.size()) {
            throw new IllegalArgumentException(
                    "Snapshot " + snapshot + " is outside the log (size " + messages.size() + ")");
        }
        messages.subList(snapshot, messages.size()).clear();
    }

    /**
     * Exact current log in transcript order.
     */
    public List<Message> asTranscript() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    /**
     * Drops the dialogue, keeping the system message if there is one.
     */
    public void reset() {
        int keep = !messages.isEmpty() && messages.get(0).isSystemMessage() ? 1 : 0;
        rollback(keep);
    }

    public int size() {
        return messages.size();
    }

    public Message lastAssistantMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isAssistantMessage()) {
                return messages.get(i);
            }
        }
        return null;
    }

    private void requireMatchingToolCall(String toolCallId) {
        Message assistant = lastAssistantMessage();
        if (assistant == null || !assistant.hasToolCalls()) {
            throw new ConversationStateException(
                    "Tool message '" + toolCallId + "' has no preceding assistant tool call");
        }
        boolean matches = assistant.getToolCalls().stream()
                .anyMatch(tc -> tc.getId() != null && tc.getId().equals(toolCallId));
        if (!matches) {
            throw new ConversationStateException(
                    "Tool message '" + toolCallId + "' does not answer any call of the last assistant message");
        }
    }
}
