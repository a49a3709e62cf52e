package me.golemcore.agent.tools;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates arithmetic expressions with {@link ExpressionEvaluator}.
 *
 * <p>
 * Output is the bare result ({@code "2+2"} gives {@code "4"}); the expression
 * and value are also returned as structured data.
 */
@Component
@Slf4j
public class CalculatorTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("calculator")
                .description("Perform mathematical calculations. Supports basic arithmetic, "
                        + "trigonometry, and common functions.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "expression", Map.of(
                                        "type", "string",
                                        "description",
                                        "Mathematical expression to evaluate (e.g., '2 + 2', 'sin(3.14)', 'sqrt(16)')")),
                        "required", List.of("expression")))
                .inputExamples(List.of(
                        Map.of("expression", "2 + 2"),
                        Map.of("expression", "sqrt(144) + pi")))
                .build();
    }

    @Override
    public String getCategory() {
        return "utilities";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object expression = parameters.get("expression");
            if (!(expression instanceof String text) || text.isBlank()) {
                return ToolResult.failure("Missing required parameter: expression");
            }
            try {
                double value = ExpressionEvaluator.evaluate(text);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return ToolResult.failure("Calculation error: result is not a finite number");
                }
                String formatted = ExpressionEvaluator.format(value);
                log.debug("[Calculator] {} = {}", text, formatted);
                return ToolResult.success(formatted, Map.of("expression", text, "result", value));
            } catch (IllegalArgumentException e) {
                return ToolResult.failure("Calculation error: " + e.getMessage());
            }
        });
    }
}
