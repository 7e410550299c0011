package me.golemcore.mailgate.domain.model;

/**
 * Terminal status of a tool result message.
 *
 * <p>
 * {@link #ERROR} marks results produced without a successful execution: a
 * failed tool, or a call terminated as rejected because the review channel
 * resumed with an error instead of a decision.
 */
public enum ToolMessageStatus {

    SUCCESS,

    ERROR
}
