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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Current date and time in an IANA timezone (or the system default).
 *
 * <p>
 * Timezone examples: {@code "America/New_York"}, {@code "Europe/London"},
 * {@code "UTC"}
 */
@Component
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool() {
        this(Clock.systemDefaultZone());
    }

    // Visible for testing
    DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is system timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public String getCategory() {
        return "utilities";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone instanceof String zone && !zone.isBlank()) {
            try {
                zoneId = ZoneId.of(zone);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + zone));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted = now.format(FORMATTER);

        Map<String, Object> data = Map.of(
                "datetime", formatted,
                "timezone", zoneId.getId(),
                "timestamp", now.toInstant().toEpochMilli(),
                "dayOfWeek", now.getDayOfWeek().name());

        return CompletableFuture.completedFuture(ToolResult.success(formatted, data));
    }
}
