package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.McpErrorCodes;
import me.golemcore.agent.port.outbound.McpException;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.McpTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolInvokerTest {

    @Mock
    private McpPort mcpPort;

    private ToolInvoker invoker;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        invoker = new ToolInvoker(mcpPort);
        context = new ToolContext();
    }

    @Test
    void shouldRefuseToolOutsideContextWithoutTransportCall() throws Exception {
        ToolNotInContextException ex = assertThrows(ToolNotInContextException.class,
                () -> invoker.invoke(context, "calculator", Map.of("expression", "2+2")));

        assertEquals("calculator", ex.getToolName());
        verify(mcpPort, never()).callTool(anyString(), any());
    }

    @Test
    void shouldAlwaysAllowBootstrapSearch() throws Exception {
        when(mcpPort.callTool("tool_search", Map.of("query", "math")))
                .thenReturn(ToolResult.success("{\"tools\":[]}"));

        ToolResult result = invoker.invoke(context, ToolContext.BOOTSTRAP_TOOL_NAME, Map.of("query", "math"));

        assertEquals("{\"tools\":[]}", result.getOutput());
    }

    @Test
    void shouldCallDiscoveredTool() throws Exception {
        context.mergeDiscovered(List.of(Map.of("name", "calculator")));
        when(mcpPort.callTool("calculator", Map.of("expression", "2+2"))).thenReturn(ToolResult.success("4"));

        ToolResult result = invoker.invoke(context, "calculator", Map.of("expression", "2+2"));

        assertEquals("4", result.getOutput());
    }

    @Test
    void shouldSendEmptyArgumentsWhenNoneGiven() throws Exception {
        when(mcpPort.callTool("tool_search", Map.of())).thenReturn(ToolResult.success("[]"));

        invoker.invoke(context, ToolContext.BOOTSTRAP_TOOL_NAME, null);

        verify(mcpPort).callTool("tool_search", Map.of());
    }

    @Test
    void shouldPropagateTransportErrors() throws Exception {
        when(mcpPort.callTool(anyString(), any()))
                .thenThrow(new McpTransportException(McpErrorCodes.CONNECTION_FAILED, "refused"));

        McpException ex = assertThrows(McpException.class,
                () -> invoker.invoke(context, ToolContext.BOOTSTRAP_TOOL_NAME, Map.of("query", "x")));

        assertEquals(McpErrorCodes.CONNECTION_FAILED, ex.getCode());
    }
}
