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

import java.time.Instant;

/**
 * A tool call held for review, as published to the review channel.
 *
 * @param requestId
 *            stable id derived from run id and tool call id, so a replayed run
 *            re-attaches to the same pending review
 * @param runId
 *            the run that is suspended
 * @param toolCall
 *            the proposed call, with its original arguments
 * @param policy
 *            the tool's policy, advertising the allowed decisions
 * @param description
 *            markdown rendering of the email context and the proposed call
 * @param createdAt
 *            when the run suspended
 */
public record ApprovalRequest(String requestId, String runId, Message.ToolCall toolCall, ToolPolicy policy,
        String description, Instant createdAt) {

    public static String requestIdFor(String runId, String toolCallId) {
        return runId + ":" + toolCallId;
    }
}
