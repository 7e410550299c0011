package me.golemcore.mailgate.domain.model;

/**
 * Serializable pointer to the decision a suspended run is waiting for. Stored
 * with the run checkpoint so the run can be replayed after a restart.
 */
public record ContinuationToken(String runId, String requestId, String toolCallId) {
}
