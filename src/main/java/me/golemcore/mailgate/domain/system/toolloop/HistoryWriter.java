package me.golemcore.mailgate.domain.system.toolloop;

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

import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.LlmResponse;

/**
 * Single writer of a run's conversation history.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse);

    /**
     * Writes an intercepted call's tool message and, after an edit, replaces the
     * proposed call in the assistant message that issued it.
     */
    void applyOutcome(AgentContext context, ToolInterceptOutcome outcome);

    void appendFinalAssistantAnswer(AgentContext context, LlmResponse llmResponse);
}
