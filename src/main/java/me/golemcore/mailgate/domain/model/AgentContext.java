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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of a single agent run. Owned exclusively by the run that created it;
 * serialized as-is into the run checkpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentContext {

    private String runId;

    private EmailInput emailInput;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;

    /**
     * Set while the run waits for a review decision.
     */
    private ContinuationToken pendingApproval;

    /**
     * Ids of rejected tool calls already turned into a triage update. Run-scoped;
     * persisted with the checkpoint.
     */
    @Builder.Default
    private Set<String> reconciledToolCallIds = new LinkedHashSet<>();

    private int currentIteration;

    private String finalAnswer;

    private String failureReason;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Returns the last {@code count} messages of the history (the whole history
     * when it is shorter).
     */
    public List<Message> recentMessages(int count) {
        if (messages == null || messages.isEmpty() || count <= 0) {
            return new ArrayList<>();
        }
        int from = Math.max(0, messages.size() - count);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }

    /**
     * Finds the most recent assistant message that proposed tool calls.
     */
    public Message findLastToolCallMessage() {
        if (messages == null) {
            return null;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message msg = messages.get(i);
            if (msg.isAssistantMessage() && msg.hasToolCalls()) {
                return msg;
            }
        }
        return null;
    }

    @JsonIgnore
    public boolean isFinished() {
        return status == RunStatus.COMPLETED
                || status == RunStatus.IGNORED
                || status == RunStatus.ITERATION_LIMIT
                || status == RunStatus.FAILED;
    }
}
