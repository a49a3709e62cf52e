package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class EchoToolTest {

    private final EchoTool tool = new EchoTool();

    @Test
    void execute_returnsMessage() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of("message", "hello")).get();

        assertTrue(result.isSuccess());
        assertEquals("hello", result.getOutput());
    }

    @Test
    void execute_withoutMessage() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of()).get();

        assertFalse(result.isSuccess());
    }
}
