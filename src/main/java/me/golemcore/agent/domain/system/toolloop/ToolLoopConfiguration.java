package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.service.ToolInvoker;
import me.golemcore.agent.domain.service.ToolSearchResultParser;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.McpPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
@ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "chat", matchIfMissing = true)
public class ToolLoopConfiguration {

    @Bean
    public ToolInvoker toolInvoker(McpPort mcpPort) {
        return new ToolInvoker(mcpPort);
    }

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolInvoker toolInvoker) {
        return new DefaultToolExecutor(toolInvoker);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter() {
        return new DefaultHistoryWriter();
    }

    @Bean
    public ToolSearchResultParser toolSearchResultParser(ObjectMapper objectMapper) {
        return new ToolSearchResultParser(objectMapper);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ToolSearchResultParser toolSearchResultParser,
            AgentProperties agentProperties) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, toolSearchResultParser,
                agentProperties.getToolLoop(), agentProperties.getLlm());
    }
}
