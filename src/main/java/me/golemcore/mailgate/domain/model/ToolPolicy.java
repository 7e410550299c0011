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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-tool review configuration. Advertises which decisions a reviewer may
 * choose; the gate does not re-validate the decision it receives against it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolPolicy {

    private String toolName;
    private boolean requiresApproval;
    private boolean allowAccept;
    private boolean allowEdit;
    private boolean allowIgnore;
    private boolean allowRespond;

    /** Namespace updated on edit and respond; null when the tool has none. */
    private MemoryNamespace memoryNamespace;

    /** Short label used in messages, e.g. "email draft". */
    private String subject;

    /** Respond feedback is an answer rather than a revision request. */
    private boolean answersQuestion;

    @JsonIgnore
    public List<DecisionType> getAllowedDecisions() {
        List<DecisionType> allowed = new ArrayList<>();
        if (allowAccept) {
            allowed.add(DecisionType.ACCEPT);
        }
        if (allowEdit) {
            allowed.add(DecisionType.EDIT);
        }
        if (allowIgnore) {
            allowed.add(DecisionType.IGNORE);
        }
        if (allowRespond) {
            allowed.add(DecisionType.RESPOND);
        }
        return allowed;
    }
}
