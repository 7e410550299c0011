package me.golemcore.mailgate.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The review ended without a decision (reviewer rejection, timeout or
     * cancellation); the call was terminated as rejected.
     */
    APPROVAL_FAILED,

    /**
     * The review channel could not publish the call, so no reviewer saw it. Not
     * a rejection.
     */
    APPROVAL_UNAVAILABLE,

    /**
     * Tool execution was denied by policy (e.g. tool unknown or disabled).
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, etc.).
     */
    EXECUTION_FAILED
}
