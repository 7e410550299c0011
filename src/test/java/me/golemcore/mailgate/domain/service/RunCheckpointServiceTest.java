package me.golemcore.mailgate.domain.service;

import me.golemcore.mailgate.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.ContinuationToken;
import me.golemcore.mailgate.domain.model.EmailInput;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.RunStatus;
import me.golemcore.mailgate.domain.model.ToolMessageStatus;
import me.golemcore.mailgate.infrastructure.config.AutoConfiguration;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunCheckpointServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private RunCheckpointService service;

    @BeforeEach
    void setUp() {
        GateProperties properties = new GateProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        service = new RunCheckpointService(storage, AutoConfiguration.objectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRestoreSuspendedRun() {
        AgentContext context = AgentContext.builder()
                .runId("run-42")
                .emailInput(new EmailInput("alice@x.com", "me@x.com", "Sync", "Can we meet?"))
                .status(RunStatus.AWAITING_APPROVAL)
                .pendingApproval(new ContinuationToken("run-42", "run-42:call-1", "call-1"))
                .currentIteration(2)
                .build();
        context.getMessages().add(Message.user("Can we meet?"));
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call-1")
                        .name("schedule_meeting")
                        .arguments(Map.of("subject", "Sync", "duration_minutes", 30))
                        .build()))
                .build());
        context.getMessages().add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId("call-0")
                .toolName("triage_email")
                .status(ToolMessageStatus.SUCCESS)
                .content("Classification Decision: respond.")
                .build());
        context.getReconciledToolCallIds().add("call-0");

        service.save(context);
        AgentContext restored = service.load("run-42").orElseThrow();

        assertEquals(RunStatus.AWAITING_APPROVAL, restored.getStatus());
        assertEquals("run-42:call-1", restored.getPendingApproval().requestId());
        assertEquals(2, restored.getCurrentIteration());
        assertEquals(3, restored.getMessages().size());
        assertEquals("schedule_meeting", restored.findLastToolCallMessage().getToolCalls().get(0).getName());
        assertEquals(30, restored.getMessages().get(1).getToolCalls().get(0).getArguments().get("duration_minutes"));
        assertEquals(ToolMessageStatus.SUCCESS, restored.getMessages().get(2).getStatus());
        assertEquals("Sync", restored.getEmailInput().subject());
        assertTrue(restored.getReconciledToolCallIds().contains("call-0"));
        assertEquals(NOW, restored.getUpdatedAt());
    }

    @Test
    void shouldReturnEmptyForUnknownRun() {
        assertTrue(service.load("missing").isEmpty());
    }

    @Test
    void shouldListSavedRuns() {
        service.save(AgentContext.builder().runId("a").build());
        service.save(AgentContext.builder().runId("b").build());

        assertEquals(List.of("a", "b"), service.listRunIds());
    }
}
