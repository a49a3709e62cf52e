package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolInvoker;
import me.golemcore.agent.domain.service.ToolNotInContextException;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpTransportException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ToolExecutorPort} backed by {@link ToolInvoker}. Errors of a single
 * call become an error-flagged outcome so the rest of the batch still runs.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final ToolInvoker toolInvoker;

    public DefaultToolExecutor(ToolInvoker toolInvoker) {
        this.toolInvoker = toolInvoker;
    }

    @Override
    public ToolExecutionOutcome execute(ToolContext toolContext, Message.ToolCall toolCall) {
        try {
            ToolResult result = toolInvoker.invoke(toolContext, toolCall.getName(), toolCall.getArguments());
            return ToolExecutionOutcome.of(toolCall, result);
        } catch (ToolNotInContextException e) {
            log.info("[ToolLoop] Refused call to {}: not in context", toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.NOT_IN_CONTEXT, "Error: " + e.getMessage());
        } catch (McpTransportException e) {
            log.warn("[ToolLoop] Transport failure in {} ({}): {}", toolCall.getName(), e.getCode(), e.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.TRANSPORT_FAILED,
                    "Error: " + e.getMessage());
        } catch (McpException e) {
            log.warn("[ToolLoop] Protocol error in {} ({}): {}", toolCall.getName(), e.getCode(), e.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, ToolFailureKind.PROTOCOL_ERROR,
                    "Error: " + e.getMessage());
        }
    }
}
