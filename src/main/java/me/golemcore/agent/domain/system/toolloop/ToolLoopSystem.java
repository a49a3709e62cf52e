package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentSession;

/**
 * Executes the LLM -> tools -> LLM loop for a single user message.
 */
public interface ToolLoopSystem {

    ToolLoopTurnResult processTurn(AgentSession session, String userText);
}
