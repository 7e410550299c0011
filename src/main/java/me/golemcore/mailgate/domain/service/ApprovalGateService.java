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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.ApprovalRejectedException;
import me.golemcore.mailgate.domain.exception.PolicyNotFoundException;
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.exception.SynthesizerException;
import me.golemcore.mailgate.domain.exception.UnknownDecisionTypeException;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.ApprovalRequest;
import me.golemcore.mailgate.domain.model.ContinuationToken;
import me.golemcore.mailgate.domain.model.Decision;
import me.golemcore.mailgate.domain.model.DecisionType;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.domain.model.ToolPolicy;
import me.golemcore.mailgate.domain.model.ToolResult;
import me.golemcore.mailgate.domain.system.toolloop.ToolInterceptOutcome;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import me.golemcore.mailgate.port.outbound.ApprovalPort;
import me.golemcore.mailgate.port.outbound.ToolExecutorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Intercepts every tool call the model proposes.
 *
 * <p>
 * Calls to tools without a review policy run directly. Otherwise the run is
 * checkpointed as suspended, the call is published through the
 * {@link ApprovalPort} and the gate blocks until a decision arrives:
 * <ul>
 * <li>accept - run with the proposed arguments</li>
 * <li>edit - run with the reviewer's arguments, rewrite the proposal in
 * history and teach the tool's namespace from the difference</li>
 * <li>ignore - skip the call, end the run and teach the triage namespace</li>
 * <li>response - skip the call and hand the reviewer's text back to the
 * model, teaching the tool's namespace</li>
 * </ul>
 * A payload without a usable decision runs the call with its original
 * arguments. Preference updates finish before the gate returns; their failures
 * are logged and never fail the run.
 */
@Service
@Slf4j
public class ApprovalGateService {

    private final ToolPolicyRegistry policyRegistry;
    private final ApprovalPort approvalPort;
    private final DecisionPayloadNormalizer normalizer;
    private final ToolExecutorPort toolExecutor;
    private final PreferenceStoreService preferenceStore;
    private final PreferenceFeedbackComposer feedbackComposer;
    private final ApprovalDisplayFormatter displayFormatter;
    private final RunCheckpointService checkpointService;
    private final GateProperties properties;
    private final Clock clock;

    public ApprovalGateService(ToolPolicyRegistry policyRegistry, ApprovalPort approvalPort,
            DecisionPayloadNormalizer normalizer, ToolExecutorPort toolExecutor,
            PreferenceStoreService preferenceStore, PreferenceFeedbackComposer feedbackComposer,
            ApprovalDisplayFormatter displayFormatter, RunCheckpointService checkpointService,
            GateProperties properties, Clock clock) {
        this.policyRegistry = policyRegistry;
        this.approvalPort = approvalPort;
        this.normalizer = normalizer;
        this.toolExecutor = toolExecutor;
        this.preferenceStore = preferenceStore;
        this.feedbackComposer = feedbackComposer;
        this.displayFormatter = displayFormatter;
        this.checkpointService = checkpointService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws PolicyNotFoundException
     *             if the tool is held for review but has no policy
     * @throws UnknownDecisionTypeException
     *             if the reviewer's decision has an unrecognized type
     */
    public ToolInterceptOutcome intercept(AgentContext context, Message.ToolCall toolCall) {
        Optional<ToolPolicy> resolved = policyRegistry.resolve(toolCall.getName());
        if (resolved.isEmpty()) {
            return execute(toolCall, toolCall.getArguments(), null, null);
        }
        ToolPolicy policy = resolved.get();

        JsonNode payload;
        try {
            payload = awaitDecision(context, toolCall, policy);
        } catch (StoreUnavailableException e) {
            return channelUnavailable(toolCall, e);
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (!isRejection(cause)) {
                return channelUnavailable(toolCall, cause);
            }
            String reason = rejectionReason(cause);
            log.warn("[Gate] Review of {} ({}) ended without a decision: {}", toolCall.getName(),
                    toolCall.getId(), reason);
            return ToolInterceptOutcome.rejected(toolCall, reason);
        }

        Optional<Decision> decision = normalizer.normalize(payload);
        if (decision.isEmpty()) {
            log.warn("[Gate] No usable decision for {} ({}), running with original arguments",
                    toolCall.getName(), toolCall.getId());
            return execute(toolCall, toolCall.getArguments(), null, null);
        }
        return apply(context, toolCall, policy, decision.get());
    }

    private JsonNode awaitDecision(AgentContext context, Message.ToolCall toolCall, ToolPolicy policy) {
        String requestId = ApprovalRequest.requestIdFor(context.getRunId(), toolCall.getId());
        ApprovalRequest request = new ApprovalRequest(requestId, context.getRunId(), toolCall, policy,
                displayFormatter.describe(context.getEmailInput(), toolCall), clock.instant());

        context.setPendingApproval(new ContinuationToken(context.getRunId(), requestId, toolCall.getId()));
        context.setStatus(RunStatus.AWAITING_APPROVAL);
        checkpointService.save(context);

        log.info("[Gate] Holding {} ({}) for review as {}, allowed: {}", toolCall.getName(), toolCall.getId(),
                requestId, policy.getAllowedDecisions());
        try {
            return approvalPort.requestApproval(request).join();
        } finally {
            context.setPendingApproval(null);
            context.setStatus(RunStatus.RUNNING);
        }
    }

    private ToolInterceptOutcome apply(AgentContext context, Message.ToolCall toolCall, ToolPolicy policy,
            Decision decision) {
        DecisionType type = decision.type();
        if (!policy.getAllowedDecisions().contains(type)) {
            log.warn("[Gate] Decision '{}' for {} was not offered to the reviewer, applying it anyway",
                    type.getWireName(), toolCall.getName());
        }
        log.info("[Gate] Decision for {} ({}): {}", toolCall.getName(), toolCall.getId(), type.getWireName());

        return switch (type) {
        case ACCEPT -> execute(toolCall, toolCall.getArguments(), DecisionType.ACCEPT, null);
        case EDIT -> applyEdit(context, toolCall, policy, (Decision.Edit) decision);
        case IGNORE -> applyIgnore(context, toolCall, policy);
        case RESPOND -> applyRespond(context, toolCall, policy, (Decision.Respond) decision);
        };
    }

    private ToolInterceptOutcome applyEdit(AgentContext context, Message.ToolCall toolCall, ToolPolicy policy,
            Decision.Edit edit) {
        Message.ToolCall edited = toolCall.withArguments(edit.arguments());
        ToolInterceptOutcome outcome = execute(edited, edited.getArguments(), DecisionType.EDIT, edited);

        MemoryNamespace namespace = policy.getMemoryNamespace();
        if (namespace != null) {
            Map<String, Object> initial = toolCall.getArguments() != null
                    ? new LinkedHashMap<>(toolCall.getArguments())
                    : Map.of();
            updatePreferences(namespace,
                    feedbackComposer.forEdit(context, subjectOf(policy), initial, edited.getArguments()));
        }
        return outcome;
    }

    private ToolInterceptOutcome applyIgnore(AgentContext context, Message.ToolCall toolCall, ToolPolicy policy) {
        String subject = subjectOf(policy);
        String content = "User ignored this " + subject + ". Ignore this email and end the workflow.";
        updatePreferences(triageNamespace(), feedbackComposer.forIgnore(context, subject));
        return ToolInterceptOutcome.notExecuted(toolCall, content, DecisionType.IGNORE, true);
    }

    private ToolInterceptOutcome applyRespond(AgentContext context, Message.ToolCall toolCall, ToolPolicy policy,
            Decision.Respond respond) {
        String feedback = respond.feedback();
        String content = policy.isAnswersQuestion()
                ? "User answered the question, which we can use for any follow up actions. Feedback: " + feedback
                : "User gave feedback, which we can incorporate into the " + subjectOf(policy) + ". Feedback: "
                        + feedback;

        MemoryNamespace namespace = policy.getMemoryNamespace();
        if (namespace != null) {
            updatePreferences(namespace, feedbackComposer.forFeedback(context, feedback));
        }
        return ToolInterceptOutcome.notExecuted(toolCall, content, DecisionType.RESPOND, false);
    }

    private ToolInterceptOutcome execute(Message.ToolCall toolCall, Map<String, Object> arguments,
            DecisionType decisionType, Message.ToolCall rewritten) {
        ToolResult result = toolExecutor.execute(toolCall.getName(), arguments);
        return ToolInterceptOutcome.executed(toolCall, result, decisionType, rewritten);
    }

    /**
     * Runs a preference update to completion. Failures leave the profile as it
     * was and do not affect the run.
     */
    void updatePreferences(MemoryNamespace namespace, List<Message> feedbackMessages) {
        try {
            preferenceStore.updateProfile(namespace, feedbackMessages);
        } catch (SynthesizerException e) {
            log.warn("[Memory] Preference update for {} failed: {}", namespace, e.getMessage());
        } catch (StoreUnavailableException e) {
            log.error("[Memory] Preference store unavailable while updating {}", namespace, e);
        }
    }

    private MemoryNamespace triageNamespace() {
        return MemoryNamespace.parse(properties.getMemory().getTriageNamespace());
    }

    private static String subjectOf(ToolPolicy policy) {
        return policy.getSubject() != null && !policy.getSubject().isBlank()
                ? policy.getSubject()
                : policy.getToolName();
    }

    private ToolInterceptOutcome channelUnavailable(Message.ToolCall toolCall, Throwable error) {
        log.error("[Gate] Review channel failed for {} ({}), call not executed", toolCall.getName(),
                toolCall.getId(), error);
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ToolInterceptOutcome.unavailable(toolCall, reason);
    }

    /**
     * Only an explicit rejection, a review timeout or a cancellation counts as
     * the reviewer declining the call.
     */
    private static boolean isRejection(Throwable cause) {
        return cause instanceof ApprovalRejectedException
                || cause instanceof TimeoutException
                || cause instanceof CancellationException;
    }

    private static String rejectionReason(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return "Review ended without a decision (" + cause.getClass().getSimpleName() + ")";
        }
        return message;
    }
}
