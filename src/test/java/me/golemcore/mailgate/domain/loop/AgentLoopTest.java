package me.golemcore.mailgate.domain.loop;

import me.golemcore.mailgate.domain.exception.UnknownDecisionTypeException;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.DecisionType;
import me.golemcore.mailgate.domain.model.LlmResponse;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.domain.model.ToolResult;
import me.golemcore.mailgate.domain.service.ApprovalGateService;
import me.golemcore.mailgate.domain.service.PreferencePromptService;
import me.golemcore.mailgate.domain.service.RejectionReconciler;
import me.golemcore.mailgate.domain.service.RunCheckpointService;
import me.golemcore.mailgate.domain.service.ToolCallExecutionService;
import me.golemcore.mailgate.domain.system.toolloop.DefaultHistoryWriter;
import me.golemcore.mailgate.domain.system.toolloop.ToolInterceptOutcome;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import me.golemcore.mailgate.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentLoopTest {

    private LlmPort llmPort;
    private ApprovalGateService gate;
    private RejectionReconciler reconciler;
    private RunCheckpointService checkpointService;
    private GateProperties properties;
    private AgentLoop loop;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        gate = mock(ApprovalGateService.class);
        reconciler = mock(RejectionReconciler.class);
        checkpointService = mock(RunCheckpointService.class);
        PreferencePromptService promptService = mock(PreferencePromptService.class);
        ToolCallExecutionService toolService = mock(ToolCallExecutionService.class);
        when(promptService.buildSystemPrompt(anyList())).thenReturn("system");
        when(toolService.getToolDefinitions()).thenReturn(List.of());
        properties = new GateProperties();

        loop = new AgentLoop(llmPort, gate, reconciler,
                new DefaultHistoryWriter(Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC)),
                promptService, toolService, checkpointService, properties);

        context = AgentContext.builder().runId("run-1").build();
        context.getMessages().add(Message.user("Can you review the API docs?"));
    }

    @Test
    void shouldCompleteOnPlainAnswer() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Nothing to do").build()));

        AgentContext result = loop.run(context);

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals("Nothing to do", result.getFinalAnswer());
        verify(reconciler).beforeModel(context);
        verify(gate, never()).intercept(any(), any());
    }

    @Test
    void shouldRouteToolCallsThroughGateUntilDone() {
        Message.ToolCall triage = call("c1", "triage_email", Map.of("classification", "respond"));
        Message.ToolCall done = call("c2", "Done", Map.of("done", true));
        when(llmPort.chat(any())).thenReturn(
                CompletableFuture.completedFuture(LlmResponse.builder().toolCalls(List.of(triage)).build()),
                CompletableFuture.completedFuture(LlmResponse.builder().toolCalls(List.of(done)).build()));
        when(gate.intercept(any(), any())).thenAnswer(invocation -> ToolInterceptOutcome.executed(
                invocation.getArgument(1), ToolResult.success("ok"), null, null));

        AgentContext result = loop.run(context);

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getCurrentIteration());
        verify(gate).intercept(context, triage);
        verify(gate).intercept(context, done);
        verify(reconciler, times(2)).afterTool(context);
        // user, assistant, tool, assistant, tool
        assertEquals(5, result.getMessages().size());
        verify(checkpointService, atLeastOnce()).save(context);
    }

    @Test
    void shouldEndRunWhenReviewerIgnores() {
        Message.ToolCall write = call("c1", "write_email", Map.of("to", "a@x.com"));
        Message.ToolCall after = call("c2", "Done", Map.of("done", true));
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().toolCalls(List.of(write, after)).build()));
        when(gate.intercept(any(), any())).thenReturn(ToolInterceptOutcome.notExecuted(write,
                "User ignored this email draft. Ignore this email and end the workflow.", DecisionType.IGNORE,
                true));

        AgentContext result = loop.run(context);

        assertEquals(RunStatus.IGNORED, result.getStatus());
        assertTrue(result.getFinalAnswer().startsWith("User ignored this email draft."));
        verify(gate, times(1)).intercept(any(), any());
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldStopAtIterationLimit() {
        properties.getLoop().setMaxIterations(3);
        AtomicInteger ids = new AtomicInteger();
        when(llmPort.chat(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                LlmResponse.builder()
                        .toolCalls(List.of(call("c" + ids.incrementAndGet(), "check_calendar_availability",
                                Map.of("day", "Monday"))))
                        .build()));
        when(gate.intercept(any(), any())).thenAnswer(invocation -> ToolInterceptOutcome.executed(
                invocation.getArgument(1), ToolResult.success("Available"), null, null));

        AgentContext result = loop.run(context);

        assertEquals(RunStatus.ITERATION_LIMIT, result.getStatus());
        assertEquals(3, result.getCurrentIteration());
        verify(llmPort, times(3)).chat(any());
    }

    @Test
    void shouldPropagateFatalGateErrors() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().toolCalls(List.of(call("c1", "write_email", Map.of()))).build()));
        when(gate.intercept(any(), any())).thenThrow(new UnknownDecisionTypeException("maybe"));

        assertThrows(UnknownDecisionTypeException.class, () -> loop.run(context));
    }

    @Test
    void shouldResumeUnansweredCallsBeforeAskingModel() {
        Message.ToolCall answered = call("c1", "triage_email", Map.of());
        Message.ToolCall pending = call("c2", "write_email", Map.of("to", "a@x.com"));
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(answered, pending))
                .build());
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId("c1")
                .toolName("triage_email")
                .content("ok")
                .build());
        context.setStatus(RunStatus.AWAITING_APPROVAL);

        when(gate.intercept(any(), any())).thenAnswer(invocation -> ToolInterceptOutcome.executed(
                invocation.getArgument(1), ToolResult.success("Email sent"), DecisionType.ACCEPT, null));
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Replied").build()));

        AgentContext result = loop.resume(context);

        verify(gate).intercept(context, pending);
        verify(gate, never()).intercept(any(), argThat(tc -> "c1".equals(tc.getId())));
        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals("Replied", result.getFinalAnswer());
    }

    @Test
    void shouldNotResumeFinishedRun() {
        context.setStatus(RunStatus.COMPLETED);

        loop.resume(context);

        verify(llmPort, never()).chat(any());
        verify(gate, never()).intercept(any(), any());
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> args) {
        return Message.ToolCall.builder().id(id).name(name).arguments(args).build();
    }
}
