package me.golemcore.mailgate.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a single entry in a run's conversation history. Supports the
 * user, assistant, system and tool roles. Assistant messages may carry the tool
 * calls proposed by the model; tool messages carry the id of the call they
 * answer and a terminal {@link ToolMessageStatus}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages
    private ToolMessageStatus status; // For tool response messages

    private Map<String, Object> metadata;
    private Instant timestamp;

    public static Message user(String content) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Checks if this is a tool result that ended in a rejected or failed state.
     */
    @JsonIgnore
    public boolean isRejectedToolResult() {
        return isToolMessage() && status == ToolMessageStatus.ERROR;
    }

    /**
     * Returns a copy of this message in which the tool call with the given id is
     * replaced. The original message and its tool call list are left untouched.
     */
    public Message withReplacedToolCall(ToolCall replacement) {
        List<ToolCall> calls = new ArrayList<>();
        if (toolCalls != null) {
            for (ToolCall call : toolCalls) {
                calls.add(call.getId() != null && call.getId().equals(replacement.getId()) ? replacement : call);
            }
        }
        return Message.builder()
                .id(id)
                .role(role)
                .content(content)
                .toolCalls(calls)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .status(status)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : null)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and arguments. Treated as immutable once issued: an edit
     * produces a new instance via {@link #withArguments(Map)}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;

        public ToolCall withArguments(Map<String, Object> newArguments) {
            return ToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(newArguments != null ? new LinkedHashMap<>(newArguments) : new LinkedHashMap<>())
                    .build();
        }
    }
}
