package me.golemcore.mailgate.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mailgate.domain.model.EmailInput;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Renders the markdown shown to a reviewer: the email being handled followed
 * by the proposed tool call.
 */
@Component
public class ApprovalDisplayFormatter {

    private final ObjectMapper objectMapper;

    public ApprovalDisplayFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String describe(EmailInput email, Message.ToolCall toolCall) {
        String emailMarkdown = email != null ? formatEmail(email) : "";
        return emailMarkdown + formatToolCall(toolCall);
    }

    public String formatEmail(EmailInput email) {
        return "\n\n**Subject**: " + nullToEmpty(email.subject())
                + "\n**From**: " + nullToEmpty(email.author())
                + "\n**To**: " + nullToEmpty(email.to())
                + "\n\n" + nullToEmpty(email.emailThread())
                + "\n\n---\n";
    }

    public String formatToolCall(Message.ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        String name = toolCall.getName();
        if (GateProperties.TOOL_WRITE_EMAIL.equals(name)) {
            return "# Email Draft\n\n"
                    + "**To**: " + value(args, "to") + "\n"
                    + "**Subject**: " + value(args, "subject") + "\n\n"
                    + value(args, "content") + "\n";
        }
        if (GateProperties.TOOL_SCHEDULE_MEETING.equals(name)) {
            return "# Calendar Invite\n\n"
                    + "**Meeting**: " + value(args, "subject") + "\n"
                    + "**Attendees**: " + value(args, "attendees") + "\n"
                    + "**Duration**: " + value(args, "duration_minutes") + " minutes\n"
                    + "**Day**: " + value(args, "preferred_day") + "\n";
        }
        if (GateProperties.TOOL_QUESTION.equals(name)) {
            return "# Question for User\n\n" + value(args, "content") + "\n";
        }
        return "# Tool Call: " + name + "\n\nArguments:\n" + toPrettyJson(args) + "\n";
    }

    public String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String value(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> items) {
            return String.join(", ", items.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
