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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes and sends an email.
 *
 * <p>
 * Placeholder transport: the email is logged and acknowledged, nothing leaves
 * the process. Held for review by default.
 */
@Component
@Slf4j
public class WriteEmailTool implements ToolComponent {

    @Override
    public ToolDefinition getDefinition() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("to", "Recipient email address");
        params.put("subject", "Email subject line");
        params.put("content", "Email body");
        return ToolDefinition.withStringParameters(GateProperties.TOOL_WRITE_EMAIL,
                "Write and send an email.", params);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String to = ToolArguments.requireString(parameters, "to");
            String subject = ToolArguments.optionalString(parameters, "subject", "");
            String content = ToolArguments.optionalString(parameters, "content", "");
            log.info("[Tools] Sending email to {} ({})", to, subject);
            return ToolResult.success(
                    "Email sent to " + to + " with subject '" + subject + "' and content: " + content);
        });
    }
}
