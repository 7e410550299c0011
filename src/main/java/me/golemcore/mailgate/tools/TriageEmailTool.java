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
import me.golemcore.mailgate.domain.model.ToolFailureKind;
import me.golemcore.mailgate.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Classifies the email as ignore, notify or respond. Must be the model's first
 * call for every email.
 */
@Component
public class TriageEmailTool implements ToolComponent {

    static final List<String> CLASSIFICATIONS = List.of("ignore", "notify", "respond");

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("triage_email")
                .description("Analyze the email content and classify it into one of three categories: "
                        + "'ignore' for irrelevant emails (marketing, spam, FYI threads), "
                        + "'notify' for important information that doesn't need a response "
                        + "(announcements, status updates), "
                        + "'respond' for emails that need a reply (direct questions, meeting requests, "
                        + "critical issues). This tool MUST be called first to determine how to handle "
                        + "the email before taking any other actions.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "reasoning", Map.of(
                                        "type", "string",
                                        "description", "Step-by-step reasoning behind the classification."),
                                "classification", Map.of(
                                        "type", "string",
                                        "enum", CLASSIFICATIONS,
                                        "description", "The classification of the email")),
                        "required", List.of("reasoning", "classification")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String classification = ToolArguments.optionalString(parameters, "classification", "")
                .trim().toLowerCase(Locale.ROOT);
        if (!CLASSIFICATIONS.contains(classification)) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Invalid classification: '" + classification + "'. Expected one of " + CLASSIFICATIONS));
        }
        String reasoning = ToolArguments.optionalString(parameters, "reasoning", "");
        return CompletableFuture.completedFuture(ToolResult.success(
                "Classification Decision: " + classification + ". Reasoning: " + reasoning,
                Map.of("classification", classification)));
    }
}
