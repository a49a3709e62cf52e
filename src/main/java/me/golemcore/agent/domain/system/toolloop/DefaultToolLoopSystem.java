package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.service.ToolSearchResultParser;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * One {@link #processTurn} call: append the user message, then repeat
 * <ol>
 * <li>LLM call with the transcript and the tools currently in context
 * <li>no tool calls → append the answer, done
 * <li>otherwise append the assistant tool-call message, execute the calls in
 * order (each result appended before the next call runs), merge what
 * {@code tool_search} discovered
 * </ol>
 * until the LLM call ceiling is reached.
 *
 * <p>
 * A failed LLM call truncates the conversation back to where it was before the
 * user message was appended. Tool failures never abort the turn.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ToolSearchResultParser searchResultParser;
    private final AgentProperties.ToolLoopProperties settings;
    private final AgentProperties.LlmProperties llmSettings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ToolSearchResultParser searchResultParser, AgentProperties.ToolLoopProperties settings,
            AgentProperties.LlmProperties llmSettings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.searchResultParser = searchResultParser;
        this.settings = settings;
        this.llmSettings = llmSettings;
    }

    @Override
    public ToolLoopTurnResult processTurn(AgentSession session, String userText) {
        ConversationState conversation = session.getConversation();
        ToolContext toolContext = session.getToolContext();

        int snapshot = conversation.snapshot();
        historyWriter.appendUserMessage(conversation, userText);

        int maxLlmCalls = settings != null ? settings.getMaxLlmCalls() : 10;
        int llmCalls = 0;
        int toolExecutions = 0;
        long totalTokens = 0;

        while (llmCalls < maxLlmCalls) {
            // 1) LLM call
            LlmResponse response;
            try {
                llmCalls++;
                response = llmPort.chat(buildRequest(conversation, toolContext)).join();
            } catch (RuntimeException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                conversation.rollback(snapshot);
                log.warn("[ToolLoop] LLM call {} failed, turn rolled back: {}", llmCalls, cause.getMessage());
                return new ToolLoopTurnResult(ToolLoopTurnResult.Outcome.ROLLED_BACK, llmCalls, toolExecutions, null,
                        cause.getMessage(), totalTokens);
            }
            if (response.getUsage() != null) {
                totalTokens += response.getUsage().getTotalTokens();
            }

            // 2) Final answer (no tool calls)
            if (!response.hasToolCalls()) {
                historyWriter.appendFinalAssistantAnswer(conversation, response);
                log.debug("[ToolLoop] Turn completed: {} LLM call(s), {} tool execution(s), {} token(s)", llmCalls,
                        toolExecutions, totalTokens);
                return new ToolLoopTurnResult(ToolLoopTurnResult.Outcome.COMPLETED, llmCalls, toolExecutions,
                        response.getContent(), null, totalTokens);
            }

            // 3) Append assistant message with tool calls
            historyWriter.appendAssistantToolCalls(conversation, response);

            // 4) Execute tools in order; discoveries become callable on the next LLM call
            List<Map<String, Object>> discovered = new ArrayList<>();
            for (Message.ToolCall tc : response.getToolCalls()) {
                ToolExecutionOutcome outcome = toolExecutor.execute(toolContext, tc);
                toolExecutions++;
                historyWriter.appendToolResult(conversation, outcome);

                if (ToolContext.BOOTSTRAP_TOOL_NAME.equals(tc.getName()) && outcome.toolResult().isSuccess()) {
                    discovered.addAll(searchResultParser.parse(outcome.messageContent()));
                }
            }
            if (!discovered.isEmpty()) {
                List<String> merged = toolContext.mergeDiscovered(discovered);
                log.info("[ToolLoop] Discovered {} tool(s): {}", merged.size(), merged);
            }
        }

        log.info("[ToolLoop] Reached max internal LLM calls ({})", maxLlmCalls);
        return new ToolLoopTurnResult(ToolLoopTurnResult.Outcome.CEILING_REACHED, llmCalls, toolExecutions, null,
                null, totalTokens);
    }

    private LlmRequest buildRequest(ConversationState conversation, ToolContext toolContext) {
        LlmRequest.LlmRequestBuilder builder = LlmRequest.builder()
                .messages(conversation.asTranscript())
                .tools(toolContext.currentDescriptors());
        if (llmSettings != null) {
            builder.model(llmSettings.getModel())
                    .temperature(llmSettings.getTemperature())
                    .maxTokens(llmSettings.getMaxTokens());
        }
        return builder.build();
    }
}
