package me.golemcore.mailgate.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * The model's proposed next action: plain text, tool calls, or both.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private List<Message.ToolCall> toolCalls;
    private String model;
    private String finishReason;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
