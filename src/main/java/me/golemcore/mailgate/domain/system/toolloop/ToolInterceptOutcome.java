package me.golemcore.mailgate.domain.system.toolloop;

import me.golemcore.mailgate.domain.model.DecisionType;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.ToolFailureKind;
import me.golemcore.mailgate.domain.model.ToolMessageStatus;
import me.golemcore.mailgate.domain.model.ToolResult;

/**
 * Outcome of one intercepted tool call, ready to be written into history.
 *
 * @param toolCallId
 *            id of the call the tool message answers
 * @param toolName
 *            name of the called tool
 * @param toolResult
 *            executor result, or null when the tool was not executed
 * @param messageContent
 *            content of the tool message
 * @param status
 *            terminal status of the tool message
 * @param rewrittenToolCall
 *            replacement for the proposed call after an edit, otherwise null
 * @param terminateRun
 *            the run must end after this call
 * @param decisionType
 *            the reviewer's decision, or null when no review took place or no
 *            usable decision arrived
 */
public record ToolInterceptOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, ToolMessageStatus status, Message.ToolCall rewrittenToolCall,
        boolean terminateRun, DecisionType decisionType) {

    public static ToolInterceptOutcome executed(Message.ToolCall toolCall, ToolResult result,
            DecisionType decisionType, Message.ToolCall rewrittenToolCall) {
        return new ToolInterceptOutcome(toolCall.getId(), toolCall.getName(), result, contentOf(result),
                result.isSuccess() ? ToolMessageStatus.SUCCESS : ToolMessageStatus.ERROR,
                rewrittenToolCall, false, decisionType);
    }

    public static ToolInterceptOutcome notExecuted(Message.ToolCall toolCall, String content,
            DecisionType decisionType, boolean terminateRun) {
        return new ToolInterceptOutcome(toolCall.getId(), toolCall.getName(), null, content,
                ToolMessageStatus.SUCCESS, null, terminateRun, decisionType);
    }

    public static ToolInterceptOutcome rejected(Message.ToolCall toolCall, String reason) {
        return new ToolInterceptOutcome(toolCall.getId(), toolCall.getName(),
                ToolResult.failure(ToolFailureKind.APPROVAL_FAILED, reason), reason,
                ToolMessageStatus.ERROR, null, false, null);
    }

    public static ToolInterceptOutcome unavailable(Message.ToolCall toolCall, String reason) {
        String content = "Review channel unavailable, " + toolCall.getName() + " was not executed: " + reason;
        return new ToolInterceptOutcome(toolCall.getId(), toolCall.getName(),
                ToolResult.failure(ToolFailureKind.APPROVAL_UNAVAILABLE, reason), content,
                ToolMessageStatus.ERROR, null, false, null);
    }

    private static String contentOf(ToolResult result) {
        if (result.isSuccess()) {
            return result.getOutput();
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }
}
