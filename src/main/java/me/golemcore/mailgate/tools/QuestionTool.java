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
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the user a question. Always held for review; the reviewer's answer
 * reaches the model as a response decision.
 */
@Component
public class QuestionTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParameters(GateProperties.TOOL_QUESTION, "Question to ask user.",
                Map.of("content", "The question"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String content = ToolArguments.optionalString(parameters, "content", "");
        return CompletableFuture.completedFuture(ToolResult.success("Question asked: " + content));
    }
}
