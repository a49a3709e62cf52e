package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;

/**
 * Executes a single tool call. Implementations never throw for tool-level
 * failures; they report them as a failed {@link ToolExecutionOutcome}.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(ToolContext toolContext, Message.ToolCall toolCall);
}
