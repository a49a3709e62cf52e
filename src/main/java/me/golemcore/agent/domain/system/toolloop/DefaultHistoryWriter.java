package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;

/**
 * Default implementation that appends to the session's {@link ConversationState}.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    @Override
    public void appendUserMessage(ConversationState conversation, String text) {
        conversation.append(Message.user(text));
    }

    @Override
    public void appendAssistantToolCalls(ConversationState conversation, LlmResponse llmResponse) {
        conversation.append(Message.assistantToolCalls(llmResponse.getContent(), llmResponse.getToolCalls()));
    }

    @Override
    public void appendToolResult(ConversationState conversation, ToolExecutionOutcome outcome) {
        conversation.append(Message.toolResult(outcome.toolCallId(), outcome.toolName(), outcome.messageContent()));
    }

    @Override
    public void appendFinalAssistantAnswer(ConversationState conversation, LlmResponse llmResponse) {
        String content = llmResponse.getContent();
        conversation.append(Message.assistant(content != null ? content : ""));
    }
}
