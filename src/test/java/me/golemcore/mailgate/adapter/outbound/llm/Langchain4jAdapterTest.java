package me.golemcore.mailgate.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.mailgate.domain.model.LlmRequest;
import me.golemcore.mailgate.domain.model.LlmResponse;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.tools.ScheduleMeetingTool;
import me.golemcore.mailgate.tools.TriageEmailTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        ChatModelFactory factory = mock(ChatModelFactory.class);
        when(factory.getModelName()).thenReturn("gpt-4o-mini");
        adapter = new Langchain4jAdapter(factory, new ObjectMapper());
    }

    @Test
    void shouldConvertConversationWithToolTraffic() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("system")
                .messages(List.of(
                        Message.user("email"),
                        Message.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .toolCalls(List.of(Message.ToolCall.builder()
                                        .id("c1").name("write_email").arguments(Map.of("to", "a@x.com")).build()))
                                .build(),
                        Message.builder()
                                .role(Message.ROLE_TOOL)
                                .toolCallId("c1")
                                .toolName("write_email")
                                .content("Email sent")
                                .build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        AiMessage ai = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("{\"to\":\"a@x.com\"}", ai.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("c1", result.id());
        assertEquals("Email sent", result.text());
    }

    @Test
    void shouldConvertToolSchemas() {
        ToolSpecification triage = adapter.convertToolDefinition(new TriageEmailTool().getDefinition());
        ToolSpecification meeting = adapter.convertToolDefinition(new ScheduleMeetingTool().getDefinition());

        assertEquals("triage_email", triage.name());
        assertInstanceOf(JsonEnumSchema.class, triage.parameters().properties().get("classification"));
        assertTrue(triage.parameters().required().contains("reasoning"));
        assertInstanceOf(JsonArraySchema.class, meeting.parameters().properties().get("attendees"));
        assertInstanceOf(JsonIntegerSchema.class, meeting.parameters().properties().get("duration_minutes"));
    }

    @Test
    void shouldConvertToolCallResponse() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("c9")
                        .name("check_calendar_availability")
                        .arguments("{\"day\":\"Monday\"}")
                        .build())))
                .build();

        LlmResponse converted = adapter.convertResponse(response);

        assertTrue(converted.hasToolCalls());
        assertEquals("c9", converted.getToolCalls().get(0).getId());
        assertEquals(Map.of("day", "Monday"), converted.getToolCalls().get(0).getArguments());
        assertEquals("gpt-4o-mini", converted.getModel());
    }
}
