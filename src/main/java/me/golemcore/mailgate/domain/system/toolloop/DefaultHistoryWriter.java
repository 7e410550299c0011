package me.golemcore.mailgate.domain.system.toolloop;

import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.LlmResponse;
import me.golemcore.mailgate.domain.model.Message;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class DefaultHistoryWriter implements HistoryWriter {

    static final String META_DECISION = "decision";
    static final String META_FAILURE_KIND = "failureKind";
    static final String META_MODEL = "model";

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .toolCalls(llmResponse.getToolCalls())
                .metadata(assistantMetadata(llmResponse))
                .timestamp(now())
                .build();
        context.getMessages().add(assistant);
    }

    @Override
    public void applyOutcome(AgentContext context, ToolInterceptOutcome outcome) {
        if (outcome.rewrittenToolCall() != null) {
            replaceToolCall(context.getMessages(), outcome.rewrittenToolCall());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (outcome.decisionType() != null) {
            metadata.put(META_DECISION, outcome.decisionType().getWireName());
        }
        if (outcome.toolResult() != null && outcome.toolResult().getFailureKind() != null) {
            metadata.put(META_FAILURE_KIND, outcome.toolResult().getFailureKind().name());
        }

        Message toolMsg = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .status(outcome.status())
                .metadata(metadata)
                .timestamp(now())
                .build();
        context.getMessages().add(toolMsg);
    }

    @Override
    public void appendFinalAssistantAnswer(AgentContext context, LlmResponse llmResponse) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .metadata(assistantMetadata(llmResponse))
                .timestamp(now())
                .build();
        context.getMessages().add(assistant);
    }

    // Newest assistant message proposing the call; earlier copies stay as they were.
    private void replaceToolCall(List<Message> messages, Message.ToolCall replacement) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message msg = messages.get(i);
            if (msg.isAssistantMessage() && msg.hasToolCalls() && msg.getToolCalls().stream()
                    .anyMatch(call -> replacement.getId().equals(call.getId()))) {
                messages.set(i, msg.withReplacedToolCall(replacement));
                return;
            }
        }
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }

    private Map<String, Object> assistantMetadata(LlmResponse llmResponse) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (llmResponse.getModel() != null && !llmResponse.getModel().isBlank()) {
            metadata.put(META_MODEL, llmResponse.getModel());
        }
        return metadata;
    }
}
