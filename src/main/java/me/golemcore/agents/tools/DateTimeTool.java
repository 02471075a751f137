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

package me.golemcore.agents.tools;

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolSchema;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns current date/time in a specified timezone (or the server clock's
 * zone). Output includes a formatted string and structured fields (year, month,
 * day, hour, minute, etc.).
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 *
 * <p>
 * Always enabled.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    static final String NAME = "datetime";
    private static final String PARAM_TIMEZONE = "timezone";
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Get the current date and time. Optionally specify a timezone.")
            .parameter(ToolParameter.builder()
                    .name(PARAM_TIMEZONE)
                    .type(ToolParameter.Type.STRING)
                    .description("Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). "
                            + "Default is the server timezone.")
                    .build())
            .build();

    private final Clock clock;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolResult execute(ExecutionContext context, Map<String, Object> input) {
        String timezone = (String) input.get(PARAM_TIMEZONE);
        ZoneId zoneId;
        if (timezone != null && !timezone.isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.strip());
            } catch (DateTimeException e) {
                throw new ToolExecutionException(NAME, "INVALID_TIMEZONE", "Invalid timezone: " + timezone, e);
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted = now.format(FORMATTER);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put(NAME, formatted);
        data.put(PARAM_TIMEZONE, zoneId.getId());
        data.put("iso", now.toOffsetDateTime().toString());
        data.put("timestamp", now.toInstant().toEpochMilli());
        data.put("day_of_week", now.getDayOfWeek().name());
        data.put("year", now.getYear());
        data.put("month", now.getMonth().name());
        data.put("day", now.getDayOfMonth());
        data.put("hour", now.getHour());
        data.put("minute", now.getMinute());
        return ToolResult.success(data);
    }
}
