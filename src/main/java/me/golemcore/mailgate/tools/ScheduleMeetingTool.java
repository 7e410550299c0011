package me.golemcore.mailgate.tools;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.component.ToolComponent;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.domain.model.ToolResult;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules a calendar meeting. Placeholder calendar: the invite is logged and
 * acknowledged. Held for review by default.
 */
@Component
@Slf4j
public class ScheduleMeetingTool implements ToolComponent {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy",
            Locale.ENGLISH);

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(GateProperties.TOOL_SCHEDULE_MEETING)
                .description("Schedule a calendar meeting.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "attendees", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Email addresses of the attendees"),
                                "subject", Map.of(
                                        "type", "string",
                                        "description", "Meeting title"),
                                "duration_minutes", Map.of(
                                        "type", "integer",
                                        "description", "Meeting length in minutes"),
                                "preferred_day", Map.of(
                                        "type", "string",
                                        "description", "Day of the meeting, ISO date (YYYY-MM-DD)"),
                                "start_time", Map.of(
                                        "type", "integer",
                                        "description", "Start hour, 24h clock")),
                        "required", List.of("attendees", "subject", "duration_minutes", "preferred_day",
                                "start_time")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            List<String> attendees = ToolArguments.stringList(parameters, "attendees");
            String subject = ToolArguments.requireString(parameters, "subject");
            int duration = ToolArguments.optionalInt(parameters, "duration_minutes", 30);
            int startTime = ToolArguments.optionalInt(parameters, "start_time", 9);
            String day = formatDay(ToolArguments.requireString(parameters, "preferred_day"));

            log.info("[Tools] Scheduling '{}' on {} with {}", subject, day, attendees);
            return ToolResult.success("Meeting '" + subject + "' scheduled on " + day + " at " + startTime
                    + " for " + duration + " minutes with " + attendees.size() + " attendees");
        });
    }

    static String formatDay(String preferredDay) {
        String trimmed = preferredDay.trim();
        String datePart = trimmed.length() >= 10 ? trimmed.substring(0, 10) : trimmed;
        try {
            return LocalDate.parse(datePart).format(DAY_FORMAT);
        } catch (DateTimeParseException e) {
            return trimmed;
        }
    }
}
