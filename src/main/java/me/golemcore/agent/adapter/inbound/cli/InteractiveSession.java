package me.golemcore.agent.adapter.inbound.cli;

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

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.McpServerInfo;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ToolInvoker;
import me.golemcore.agent.domain.service.ToolNotInContextException;
import me.golemcore.agent.domain.service.ToolSearchResultParser;
import me.golemcore.agent.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agent.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Plain terminal front end: one line per user turn, slash commands for the
 * tool context.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "chat", matchIfMissing = true)
@Slf4j
public class InteractiveSession implements CommandLineRunner {

    private static final String HELP = """
            Commands:
              /help            show this help
              /context         tools currently in context
              /search <query>  search for tools and add them to context
              /tools           all tools on the server
              /clear           clear the tool context (tool_search stays)
              /reset           clear the conversation
              /quit            exit
            Anything else is sent to the assistant.""";

    private final McpPort mcpPort;
    private final ToolLoopSystem toolLoopSystem;
    private final ToolInvoker toolInvoker;
    private final ToolSearchResultParser searchResultParser;
    private final AgentProperties properties;

    public InteractiveSession(McpPort mcpPort, ToolLoopSystem toolLoopSystem, ToolInvoker toolInvoker,
            ToolSearchResultParser searchResultParser, AgentProperties properties) {
        this.mcpPort = mcpPort;
        this.toolLoopSystem = toolLoopSystem;
        this.toolInvoker = toolInvoker;
        this.searchResultParser = searchResultParser;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        runSession(in, System.out);
    }

    public void runSession(BufferedReader in, PrintStream out) throws IOException {
        try {
            McpServerInfo info = mcpPort.initialize();
            out.println("Connected to " + info.getName() + " " + info.getVersion());
        } catch (McpException e) {
            out.println("Failed to connect to MCP server: " + e.getMessage() + " (" + e.getCode() + ")");
            return;
        }

        AgentSession session = new AgentSession(properties.getLlm().getSystemPrompt());
        out.println("Model: " + properties.getLlm().getModel() + ". Type /help for commands.");

        while (true) {
            out.print("[" + session.getToolContext().size() + " tools] You: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("/")) {
                if (!handleCommand(session, line, out)) {
                    break;
                }
                continue;
            }
            handleTurn(session, line, out);
        }
        out.println("Goodbye.");
    }

    /**
     * @return false when the session should end
     */
    boolean handleCommand(AgentSession session, String line, PrintStream out) {
        String[] parts = line.split("\\s+", 2);
        String argument = parts.length > 1 ? parts[1].trim() : "";
        switch (parts[0].toLowerCase()) {
        case "/help" -> out.println(HELP);
        case "/context" -> printTools(session.getToolContext().currentDescriptors(), out);
        case "/search" -> search(session, argument, out);
        case "/tools" -> listServerTools(out);
        case "/clear" -> {
            session.getToolContext().clear();
            out.println("Tool context cleared.");
        }
        case "/reset" -> {
            session.getConversation().reset();
            out.println("Conversation cleared.");
        }
        case "/quit", "/exit" -> {
            return false;
        }
        default -> out.println("Unknown command: " + parts[0] + ". Type /help for commands.");
        }
        return true;
    }

    void handleTurn(AgentSession session, String text, PrintStream out) {
        ToolLoopTurnResult result = toolLoopSystem.processTurn(session, text);
        switch (result.outcome()) {
        case COMPLETED -> out.println("Assistant: " + (result.finalText() != null ? result.finalText() : ""));
        case CEILING_REACHED -> out.println("[Stopped after " + result.llmCalls()
                + " model calls without a final answer]");
        case ROLLED_BACK -> out.println("Error: " + result.error() + ". Your last message was not kept.");
        }
        if (result.toolExecutions() > 0 || result.totalTokens() > 0) {
            out.println("[" + result.toolExecutions() + " tool call(s), " + result.llmCalls() + " model call(s), "
                    + result.totalTokens() + " tokens]");
        }
        log.debug("[Session {}] Turn {}: {} LLM call(s), {} tool execution(s)", session.getId(), result.outcome(),
                result.llmCalls(), result.toolExecutions());
    }

    private void search(AgentSession session, String query, PrintStream out) {
        if (query.isEmpty()) {
            out.println("Usage: /search <query>");
            return;
        }
        try {
            ToolResult result = toolInvoker.invoke(session.getToolContext(), ToolContext.BOOTSTRAP_TOOL_NAME,
                    Map.of("query", query));
            if (!result.isSuccess()) {
                out.println("Search failed: " + result.getOutput());
                return;
            }
            List<String> merged = session.getToolContext()
                    .mergeDiscovered(searchResultParser.parse(result.getOutput()));
            out.println(merged.isEmpty() ? "No tools found." : "Added to context: " + String.join(", ", merged));
        } catch (ToolNotInContextException | McpException e) {
            out.println("Search failed: " + e.getMessage());
        }
    }

    private void listServerTools(PrintStream out) {
        try {
            printTools(mcpPort.listTools(), out);
        } catch (McpException e) {
            out.println("Failed to list tools: " + e.getMessage());
        }
    }

    private static void printTools(List<ToolDefinition> tools, PrintStream out) {
        out.println(tools.size() + " tool(s):");
        for (ToolDefinition tool : tools) {
            out.println("  " + tool.getName() + " - " + tool.getDescription());
        }
    }
}
