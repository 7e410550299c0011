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

import me.golemcore.mailgate.domain.component.ToolComponent;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports open slots for a day. Placeholder calendar with fixed slots.
 */
@Component
public class CheckCalendarAvailabilityTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParameters("check_calendar_availability",
                "Check calendar availability for a given day.",
                Map.of("day", "Day to check, e.g. 2025-05-20 or Tuesday"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String day = ToolArguments.requireString(parameters, "day");
        return CompletableFuture.completedFuture(
                ToolResult.success("Available times on " + day + ": 9:00 AM, 2:00 PM, 4:00 PM"));
    }
}
