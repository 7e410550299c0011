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
import me.golemcore.mailgate.domain.loop.AgentLoop;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.EmailInput;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.UnaryOperator;

/**
 * Starts, resumes and looks up runs. Each run executes on the run executor;
 * independent runs proceed concurrently and a run is never executed twice at
 * the same time.
 */
@Service
@Slf4j
public class AgentRunCoordinator {

    private final AgentLoop agentLoop;
    private final RunCheckpointService checkpointService;
    private final ApprovalDisplayFormatter displayFormatter;
    private final ExecutorService runExecutor;
    private final GateProperties properties;
    private final Clock clock;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    public AgentRunCoordinator(AgentLoop agentLoop, RunCheckpointService checkpointService,
            ApprovalDisplayFormatter displayFormatter, ExecutorService runExecutor, GateProperties properties,
            Clock clock) {
        this.agentLoop = agentLoop;
        this.checkpointService = checkpointService;
        this.displayFormatter = displayFormatter;
        this.runExecutor = runExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a run for the email and schedules it.
     *
     * @return the new run's initial state
     */
    public AgentContext startRun(EmailInput email) {
        AgentContext context = AgentContext.builder()
                .runId(UUID.randomUUID().toString())
                .emailInput(email)
                .createdAt(clock.instant())
                .build();
        Message first = Message.user(displayFormatter.formatEmail(email));
        first.setId(UUID.randomUUID().toString());
        first.setTimestamp(clock.instant());
        context.getMessages().add(first);
        checkpointService.save(context);

        log.info("[Loop] Starting run {} for '{}'", context.getRunId(), email.subject());
        submit(context, agentLoop::run);
        return context;
    }

    /**
     * Replays a stored run from its checkpoint.
     *
     * @throws IllegalArgumentException
     *             if no checkpoint exists for the run
     * @throws IllegalStateException
     *             if the run is executing or already finished
     */
    public AgentContext resumeRun(String runId) {
        AgentContext context = checkpointService.load(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        if (context.isFinished()) {
            throw new IllegalStateException("Run already finished: " + runId);
        }
        if (activeRuns.contains(runId)) {
            throw new IllegalStateException("Run is already executing: " + runId);
        }
        submit(context, agentLoop::resume);
        return context;
    }

    public Optional<AgentContext> getRun(String runId) {
        return checkpointService.load(runId);
    }

    public boolean isActive(String runId) {
        return activeRuns.contains(runId);
    }

    /**
     * Replays runs that were suspended at a review when the process stopped.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void resumeSuspendedRuns() {
        if (!properties.getRuns().isResumeOnStartup()) {
            return;
        }
        for (String runId : checkpointService.listRunIds()) {
            checkpointService.load(runId)
                    .filter(ctx -> ctx.getStatus() == RunStatus.AWAITING_APPROVAL
                            || ctx.getStatus() == RunStatus.RUNNING)
                    .ifPresent(ctx -> {
                        log.info("[Loop] Replaying interrupted run {} ({})", runId, ctx.getStatus());
                        submit(ctx, agentLoop::resume);
                    });
        }
    }

    private void submit(AgentContext context, UnaryOperator<AgentContext> step) {
        String runId = context.getRunId();
        if (!activeRuns.add(runId)) {
            throw new IllegalStateException("Run is already executing: " + runId);
        }
        try {
            runExecutor.execute(() -> execute(context, step));
        } catch (RuntimeException e) {
            activeRuns.remove(runId);
            throw e;
        }
    }

    private void execute(AgentContext context, UnaryOperator<AgentContext> step) {
        try {
            AgentContext result = step.apply(context);
            log.info("[Loop] Run {} ended: {}", result.getRunId(), result.getStatus());
        } catch (RuntimeException e) {
            log.error("[Loop] Run {} failed", context.getRunId(), e);
            context.setStatus(RunStatus.FAILED);
            context.setPendingApproval(null);
            context.setFailureReason(e.getMessage());
            checkpointService.save(context);
        } finally {
            activeRuns.remove(context.getRunId());
        }
    }
}
