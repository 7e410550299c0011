package me.golemcore.mailgate.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mailgate.domain.loop.AgentLoop;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.EmailInput;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentRunCoordinatorTest {

    private AgentLoop agentLoop;
    private RunCheckpointService checkpointService;
    private GateProperties properties;
    private AgentRunCoordinator coordinator;

    @BeforeEach
    void setUp() {
        agentLoop = mock(AgentLoop.class);
        checkpointService = mock(RunCheckpointService.class);
        properties = new GateProperties();
        ExecutorService directExecutor = mock(ExecutorService.class);
        doAnswer(invocation -> {
            Runnable task = invocation.getArgument(0);
            task.run();
            return null;
        }).when(directExecutor).execute(any(Runnable.class));

        coordinator = new AgentRunCoordinator(agentLoop, checkpointService,
                new ApprovalDisplayFormatter(new ObjectMapper()), directExecutor, properties,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldStartRunWithEmailAsFirstMessage() {
        when(agentLoop.run(any())).thenAnswer(invocation -> {
            AgentContext ctx = invocation.getArgument(0);
            ctx.setStatus(RunStatus.COMPLETED);
            return ctx;
        });

        AgentContext context = coordinator.startRun(
                new EmailInput("alice@x.com", "me@x.com", "Docs", "Please review."));

        assertEquals(1, context.getMessages().size());
        assertTrue(context.getMessages().get(0).getContent().contains("**Subject**: Docs"));
        assertEquals(RunStatus.COMPLETED, context.getStatus());
        assertFalse(coordinator.isActive(context.getRunId()));
    }

    @Test
    void shouldMarkRunFailedWhenLoopThrows() {
        when(agentLoop.run(any())).thenThrow(new IllegalStateException("LLM chat failed"));

        AgentContext context = coordinator.startRun(new EmailInput("a", "b", "c", "d"));

        assertEquals(RunStatus.FAILED, context.getStatus());
        assertEquals("LLM chat failed", context.getFailureReason());
        verify(checkpointService, atLeastOnce()).save(context);
    }

    @Test
    void shouldRefuseToResumeFinishedRun() {
        when(checkpointService.load("run-1")).thenReturn(Optional.of(
                AgentContext.builder().runId("run-1").status(RunStatus.COMPLETED).build()));

        assertThrows(IllegalStateException.class, () -> coordinator.resumeRun("run-1"));
        assertThrows(IllegalArgumentException.class, () -> coordinator.resumeRun("missing"));
    }

    @Test
    void shouldReplaySuspendedRunsOnStartup() {
        AgentContext suspended = AgentContext.builder().runId("s").status(RunStatus.AWAITING_APPROVAL).build();
        AgentContext finished = AgentContext.builder().runId("f").status(RunStatus.IGNORED).build();
        when(checkpointService.listRunIds()).thenReturn(List.of("s", "f"));
        when(checkpointService.load("s")).thenReturn(Optional.of(suspended));
        when(checkpointService.load("f")).thenReturn(Optional.of(finished));
        when(agentLoop.resume(any())).thenAnswer(invocation -> invocation.getArgument(0));

        coordinator.resumeSuspendedRuns();

        ArgumentCaptor<AgentContext> resumed = ArgumentCaptor.forClass(AgentContext.class);
        verify(agentLoop).resume(resumed.capture());
        assertEquals("s", resumed.getValue().getRunId());
    }

    @Test
    void shouldSkipReplayWhenDisabled() {
        properties.getRuns().setResumeOnStartup(false);

        coordinator.resumeSuspendedRuns();

        verify(checkpointService, never()).listRunIds();
    }
}
