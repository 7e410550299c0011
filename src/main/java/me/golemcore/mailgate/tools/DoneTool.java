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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Signals that handling of the email is complete. Listed in
 * {@code gate.loop.terminal-tools}, so the run ends once it succeeds.
 */
@Component
public class DoneTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("Done")
                .description("E-mail has been sent.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "done", Map.of(
                                        "type", "boolean",
                                        "description", "True when the task is complete")),
                        "required", List.of("done")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.completedFuture(ToolResult.success("Done"));
    }
}
