package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.LlmResponse;

/**
 * Single point of mutation for the conversation log during a turn.
 *
 * <p>
 * ToolLoopSystem should not write messages directly.
 */
public interface HistoryWriter {

    void appendUserMessage(ConversationState conversation, String text);

    void appendAssistantToolCalls(ConversationState conversation, LlmResponse llmResponse);

    void appendToolResult(ConversationState conversation, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(ConversationState conversation, LlmResponse llmResponse);
}
