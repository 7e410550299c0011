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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.exception.SynthesizerException;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.ToolFailureKind;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catches rejected tool calls that reached history without passing through a
 * live review decision, and teaches the triage namespace from them.
 *
 * <p>
 * A rejection is a tool message with status ERROR for a watched tool. Calls
 * that ran and failed are not rejections and are skipped. Each tool call id is
 * processed at most once per run; processed ids are kept in
 * {@link AgentContext#getReconciledToolCallIds()} and survive checkpoints.
 */
@Service
@Slf4j
public class RejectionReconciler {

    private static final String META_FAILURE_KIND = "failureKind";

    private final GateProperties properties;
    private final PreferenceStoreService preferenceStore;
    private final PreferenceFeedbackComposer feedbackComposer;
    private final ToolPolicyRegistry policyRegistry;

    public RejectionReconciler(GateProperties properties, PreferenceStoreService preferenceStore,
            PreferenceFeedbackComposer feedbackComposer, ToolPolicyRegistry policyRegistry) {
        this.properties = properties;
        this.preferenceStore = preferenceStore;
        this.feedbackComposer = feedbackComposer;
        this.policyRegistry = policyRegistry;
    }

    /** Checkpoint before every model turn. */
    public int beforeModel(AgentContext context) {
        return reconcile(context);
    }

    /** Checkpoint after every tool message. */
    public int afterTool(AgentContext context) {
        return reconcile(context);
    }

    /**
     * @return number of rejections processed by this scan
     */
    public int reconcile(AgentContext context) {
        if (!properties.getReconciler().isEnabled() || context.getMessages() == null) {
            return 0;
        }
        Set<String> processed = context.getReconciledToolCallIds();
        List<String> watched = properties.getReconciler().getWatchedTools();

        List<Message> rejected = new ArrayList<>();
        List<Message> messages = context.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message msg = messages.get(i);
            if (msg.isRejectedToolResult()
                    && watched.contains(msg.getToolName())
                    && msg.getToolCallId() != null
                    && !processed.contains(msg.getToolCallId())
                    && !isNotReviewerRejection(msg)) {
                rejected.add(msg);
            }
        }

        for (Message msg : rejected) {
            Map<String, Object> originalArgs = findOriginalArguments(messages, msg.getToolCallId());
            log.info("[Reconciler] Rejected {} ({}), updating triage preferences", msg.getToolName(),
                    msg.getToolCallId());
            List<Message> feedback = feedbackComposer.forRejection(context,
                    policyRegistry.subjectOf(msg.getToolName()), msg.getToolName(), originalArgs, msg.getContent());
            updateTriage(feedback);
            processed.add(msg.getToolCallId());
        }
        return rejected.size();
    }

    private static boolean isNotReviewerRejection(Message msg) {
        Object kind = msg.getMetadata() != null ? msg.getMetadata().get(META_FAILURE_KIND) : null;
        return ToolFailureKind.EXECUTION_FAILED.name().equals(kind)
                || ToolFailureKind.POLICY_DENIED.name().equals(kind)
                || ToolFailureKind.APPROVAL_UNAVAILABLE.name().equals(kind);
    }

    private static Map<String, Object> findOriginalArguments(List<Message> messages, String toolCallId) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message msg = messages.get(i);
            if (!msg.isAssistantMessage() || !msg.hasToolCalls()) {
                continue;
            }
            for (Message.ToolCall call : msg.getToolCalls()) {
                if (toolCallId.equals(call.getId())) {
                    return call.getArguments() != null ? new LinkedHashMap<>(call.getArguments()) : Map.of();
                }
            }
        }
        return Map.of();
    }

    private void updateTriage(List<Message> feedback) {
        MemoryNamespace namespace = MemoryNamespace.parse(properties.getMemory().getTriageNamespace());
        try {
            preferenceStore.updateProfile(namespace, feedback);
        } catch (SynthesizerException e) {
            log.warn("[Reconciler] Triage update failed: {}", e.getMessage());
        } catch (StoreUnavailableException e) {
            log.error("[Reconciler] Preference store unavailable", e);
        }
    }
}
