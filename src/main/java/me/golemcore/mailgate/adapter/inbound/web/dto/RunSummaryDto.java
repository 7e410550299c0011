package me.golemcore.mailgate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.ContinuationToken;

import java.time.Instant;

/**
 * Run state without the conversation history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummaryDto {
    private String runId;
    private String subject;
    private String status;
    private boolean active;
    private ContinuationToken pendingApproval;
    private int iterations;
    private int messageCount;
    private String finalAnswer;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;

    public static RunSummaryDto from(AgentContext context, boolean active) {
        return RunSummaryDto.builder()
                .runId(context.getRunId())
                .subject(context.getEmailInput() != null ? context.getEmailInput().subject() : null)
                .status(context.getStatus().name())
                .active(active)
                .pendingApproval(context.getPendingApproval())
                .iterations(context.getCurrentIteration())
                .messageCount(context.getMessages() != null ? context.getMessages().size() : 0)
                .finalAnswer(context.getFinalAnswer())
                .failureReason(context.getFailureReason())
                .createdAt(context.getCreatedAt())
                .updatedAt(context.getUpdatedAt())
                .build();
    }
}
