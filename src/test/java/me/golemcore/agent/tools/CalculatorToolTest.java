package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @Test
    void getDefinition_requiresExpressionAndHasExamples() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("calculator", definition.getName());
        assertEquals(List.of("expression"), definition.getInputSchema().get("required"));
        assertFalse(definition.getInputExamples().isEmpty());
        assertEquals("utilities", tool.getCategory());
    }

    @Test
    void execute_returnsBareResult() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of("expression", "2+2")).get();

        assertTrue(result.isSuccess());
        assertEquals("4", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("2+2", data.get("expression"));
        assertEquals(4.0, data.get("result"));
    }

    @Test
    void execute_keepsFractionalResults() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of("expression", "1 / 4")).get();

        assertEquals("0.25", result.getOutput());
    }

    @Test
    void execute_reportsDivisionByZero() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of("expression", "1/0")).get();

        assertFalse(result.isSuccess());
        assertEquals("Calculation error: Division by zero", result.getOutput());
    }

    @Test
    void execute_reportsNonFiniteResult() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of("expression", "sqrt(-1)")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Calculation error"));
    }

    @Test
    void execute_withoutExpression() throws ExecutionException, InterruptedException {
        ToolResult result = tool.execute(Map.of()).get();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: expression", result.getOutput());
    }
}
