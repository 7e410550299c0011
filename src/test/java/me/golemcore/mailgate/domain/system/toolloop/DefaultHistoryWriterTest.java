package me.golemcore.mailgate.domain.system.toolloop;

import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.DecisionType;
import me.golemcore.mailgate.domain.model.LlmResponse;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.model.ToolMessageStatus;
import me.golemcore.mailgate.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHistoryWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private DefaultHistoryWriter writer;
    private AgentContext context;
    private Message.ToolCall proposed;

    @BeforeEach
    void setUp() {
        writer = new DefaultHistoryWriter(Clock.fixed(NOW, ZoneOffset.UTC));
        context = AgentContext.builder().runId("run-1").build();
        context.getMessages().add(Message.user("email"));
        proposed = Message.ToolCall.builder()
                .id("call-1")
                .name("write_email")
                .arguments(Map.of("content", "Hi"))
                .build();
        writer.appendAssistantToolCalls(context, LlmResponse.builder()
                .toolCalls(List.of(proposed))
                .model("gpt-4o-mini")
                .build());
    }

    @Test
    void shouldAppendAssistantMessageWithModel() {
        Message assistant = context.getMessages().get(1);

        assertTrue(assistant.isAssistantMessage());
        assertEquals("gpt-4o-mini", assistant.getMetadata().get(DefaultHistoryWriter.META_MODEL));
        assertEquals(NOW, assistant.getTimestamp());
    }

    @Test
    void shouldAppendToolMessageWithDecision() {
        ToolInterceptOutcome outcome = ToolInterceptOutcome.executed(proposed, ToolResult.success("Email sent"),
                DecisionType.ACCEPT, null);

        writer.applyOutcome(context, outcome);

        Message tool = context.getMessages().get(2);
        assertTrue(tool.isToolMessage());
        assertEquals("call-1", tool.getToolCallId());
        assertEquals("write_email", tool.getToolName());
        assertEquals("Email sent", tool.getContent());
        assertEquals(ToolMessageStatus.SUCCESS, tool.getStatus());
        assertEquals("accept", tool.getMetadata().get(DefaultHistoryWriter.META_DECISION));
    }

    @Test
    void shouldRewriteProposalAfterEdit() {
        Message original = context.getMessages().get(1);
        Message.ToolCall edited = proposed.withArguments(Map.of("content", "Hello there"));

        writer.applyOutcome(context, ToolInterceptOutcome.executed(edited, ToolResult.success("Email sent"),
                DecisionType.EDIT, edited));

        Message rewritten = context.getMessages().get(1);
        assertNotSame(original, rewritten);
        assertEquals("Hello there", rewritten.getToolCalls().get(0).getArguments().get("content"));
        assertEquals("Hi", original.getToolCalls().get(0).getArguments().get("content"));
        assertEquals(3, context.getMessages().size());
    }

    @Test
    void shouldRecordRejectionAsError() {
        writer.applyOutcome(context, ToolInterceptOutcome.rejected(proposed, "Not now"));

        Message tool = context.getMessages().get(2);
        assertTrue(tool.isRejectedToolResult());
        assertEquals("Not now", tool.getContent());
        assertEquals("APPROVAL_FAILED", tool.getMetadata().get(DefaultHistoryWriter.META_FAILURE_KIND));
        assertFalse(tool.getMetadata().containsKey(DefaultHistoryWriter.META_DECISION));
    }

    @Test
    void shouldAppendFinalAnswer() {
        writer.appendFinalAssistantAnswer(context, LlmResponse.builder().content("All done").build());

        Message last = context.getMessages().get(context.getMessages().size() - 1);
        assertTrue(last.isAssistantMessage());
        assertFalse(last.hasToolCalls());
        assertEquals("All done", last.getContent());
    }
}
