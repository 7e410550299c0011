package me.golemcore.mailgate.domain.loop;

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
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.LlmRequest;
import me.golemcore.mailgate.domain.model.LlmResponse;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.domain.model.ToolMessageStatus;
import me.golemcore.mailgate.domain.service.ApprovalGateService;
import me.golemcore.mailgate.domain.service.PreferencePromptService;
import me.golemcore.mailgate.domain.service.RejectionReconciler;
import me.golemcore.mailgate.domain.service.RunCheckpointService;
import me.golemcore.mailgate.domain.service.ToolCallExecutionService;
import me.golemcore.mailgate.domain.system.toolloop.HistoryWriter;
import me.golemcore.mailgate.domain.system.toolloop.ToolInterceptOutcome;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import me.golemcore.mailgate.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives a single run: ask the model for the next action, pass every proposed
 * tool call through the approval gate, write the outcome into history, repeat.
 *
 * <p>
 * The reconciler runs before every model turn and after every tool message.
 * The run is checkpointed after every step, so a run suspended at a review can
 * be replayed with {@link #resume(AgentContext)}. Fatal gate errors propagate
 * to the caller.
 */
@Component
@Slf4j
public class AgentLoop {

    private final LlmPort llmPort;
    private final ApprovalGateService approvalGate;
    private final RejectionReconciler reconciler;
    private final HistoryWriter historyWriter;
    private final PreferencePromptService promptService;
    private final ToolCallExecutionService toolService;
    private final RunCheckpointService checkpointService;
    private final GateProperties properties;

    public AgentLoop(LlmPort llmPort, ApprovalGateService approvalGate, RejectionReconciler reconciler,
            HistoryWriter historyWriter, PreferencePromptService promptService,
            ToolCallExecutionService toolService, RunCheckpointService checkpointService,
            GateProperties properties) {
        this.llmPort = llmPort;
        this.approvalGate = approvalGate;
        this.reconciler = reconciler;
        this.historyWriter = historyWriter;
        this.promptService = promptService;
        this.toolService = toolService;
        this.checkpointService = checkpointService;
        this.properties = properties;
    }

    public AgentContext run(AgentContext context) {
        int maxIterations = properties.getLoop().getMaxIterations();
        context.setStatus(RunStatus.RUNNING);

        while (!context.isFinished()) {
            if (context.getCurrentIteration() >= maxIterations) {
                log.warn("[Loop] Run {} reached max iterations ({})", context.getRunId(), maxIterations);
                context.setStatus(RunStatus.ITERATION_LIMIT);
                context.setFailureReason("Reached max iterations (" + maxIterations + ")");
                break;
            }

            reconciler.beforeModel(context);

            LlmResponse response = llmPort.chat(buildRequest(context)).join();
            context.setCurrentIteration(context.getCurrentIteration() + 1);

            if (response == null || !response.hasToolCalls()) {
                if (response != null) {
                    historyWriter.appendFinalAssistantAnswer(context, response);
                    context.setFinalAnswer(response.getContent());
                }
                context.setStatus(RunStatus.COMPLETED);
                log.info("[Loop] Run {} completed with a final answer", context.getRunId());
                break;
            }

            historyWriter.appendAssistantToolCalls(context, response);
            checkpointService.save(context);

            processToolCalls(context, response.getToolCalls());
        }

        checkpointService.save(context);
        return context;
    }

    /**
     * Continues a run from its checkpoint. Calls of the last assistant message
     * that have no tool message yet are intercepted again; a pending review
     * re-attaches under the same request id.
     */
    public AgentContext resume(AgentContext context) {
        if (context.isFinished()) {
            return context;
        }
        log.info("[Loop] Resuming run {} at iteration {}", context.getRunId(), context.getCurrentIteration());
        context.setStatus(RunStatus.RUNNING);
        context.setPendingApproval(null);

        Message last = context.findLastToolCallMessage();
        if (last != null) {
            processToolCalls(context, last.getToolCalls());
        }
        if (context.isFinished()) {
            checkpointService.save(context);
            return context;
        }
        return run(context);
    }

    private void processToolCalls(AgentContext context, List<Message.ToolCall> toolCalls) {
        Set<String> answered = answeredToolCallIds(context);
        for (Message.ToolCall toolCall : toolCalls) {
            if (answered.contains(toolCall.getId())) {
                continue;
            }

            ToolInterceptOutcome outcome = approvalGate.intercept(context, toolCall);
            historyWriter.applyOutcome(context, outcome);
            reconciler.afterTool(context);
            checkpointService.save(context);

            if (outcome.terminateRun()) {
                log.info("[Loop] Run {} ended by reviewer at {}", context.getRunId(), toolCall.getName());
                context.setStatus(RunStatus.IGNORED);
                context.setFinalAnswer(outcome.messageContent());
                return;
            }
            if (isTerminalTool(toolCall) && outcome.status() == ToolMessageStatus.SUCCESS) {
                log.info("[Loop] Run {} finished via {}", context.getRunId(), toolCall.getName());
                context.setStatus(RunStatus.COMPLETED);
                context.setFinalAnswer(outcome.messageContent());
                return;
            }
        }
    }

    private boolean isTerminalTool(Message.ToolCall toolCall) {
        return properties.getLoop().getTerminalTools().contains(toolCall.getName());
    }

    private static Set<String> answeredToolCallIds(AgentContext context) {
        Set<String> ids = new HashSet<>();
        for (Message msg : context.getMessages()) {
            if (msg.isToolMessage() && msg.getToolCallId() != null) {
                ids.add(msg.getToolCallId());
            }
        }
        return ids;
    }

    private LlmRequest buildRequest(AgentContext context) {
        List<ToolDefinition> tools = toolService.getToolDefinitions();
        return LlmRequest.builder()
                .systemPrompt(promptService.buildSystemPrompt(tools))
                .messages(new ArrayList<>(context.getMessages()))
                .tools(tools)
                .runId(context.getRunId())
                .build();
    }
}
