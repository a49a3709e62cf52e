package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void shouldRegisterToolSearchFirst() {
        ToolRegistry registry = registry(List.of(new StubTool("alpha", true)));

        List<String> names = registry.all().stream().map(ToolComponent::getToolName).toList();

        assertEquals(List.of(ToolContext.BOOTSTRAP_TOOL_NAME, "alpha"), names);
    }

    @Test
    void shouldKeepFirstRegistrationOnDuplicateName() {
        StubTool first = new StubTool("alpha", true);
        ToolRegistry registry = registry(List.of(first, new StubTool("alpha", true)));

        assertEquals(2, registry.all().size());
        assertSame(first, registry.find("alpha").orElseThrow());
    }

    @Test
    void shouldSkipDisabledTools() {
        ToolRegistry registry = registry(List.of(new StubTool("alpha", false)));

        assertTrue(registry.find("alpha").isEmpty());
    }

    @Test
    void shouldReturnEmptyForUnknownOrNullName() {
        ToolRegistry registry = registry(List.of());

        assertTrue(registry.find("missing").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    private static ToolRegistry registry(List<ToolComponent> components) {
        return new ToolRegistry(components, new AgentProperties(), new ObjectMapper());
    }

    private record StubTool(String name, boolean enabled) implements ToolComponent {

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder().name(name).description(name + " tool").build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return CompletableFuture.completedFuture(ToolResult.success(name));
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
