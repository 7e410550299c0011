package me.golemcore.mailgate.tools;

import me.golemcore.mailgate.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailToolsTest {

    @Test
    void triageShouldEchoClassification() {
        ToolResult result = new TriageEmailTool().execute(Map.of(
                "reasoning", "Direct question from a colleague",
                "classification", "respond")).join();

        assertTrue(result.isSuccess());
        assertEquals("Classification Decision: respond. Reasoning: Direct question from a colleague",
                result.getOutput());
    }

    @Test
    void triageShouldRejectUnknownClassification() {
        ToolResult result = new TriageEmailTool().execute(Map.of("classification", "archive")).join();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("archive"));
    }

    @Test
    void scheduleMeetingShouldFormatDay() {
        ToolResult result = new ScheduleMeetingTool().execute(Map.of(
                "attendees", List.of("alice@x.com", "bob@x.com"),
                "subject", "API review",
                "duration_minutes", 45,
                "preferred_day", "2026-03-03T00:00:00",
                "start_time", 14)).join();

        assertEquals("Meeting 'API review' scheduled on Tuesday, March 03, 2026 at 14 for 45 minutes "
                + "with 2 attendees", result.getOutput());
    }

    @Test
    void scheduleMeetingShouldKeepFreeFormDay() {
        assertEquals("next Tuesday", ScheduleMeetingTool.formatDay("next Tuesday"));
    }

    @Test
    void calendarShouldListFixedSlots() {
        ToolResult result = new CheckCalendarAvailabilityTool().execute(Map.of("day", "Monday")).join();

        assertEquals("Available times on Monday: 9:00 AM, 2:00 PM, 4:00 PM", result.getOutput());
    }

    @Test
    void calendarShouldRequireDay() {
        assertThrows(IllegalArgumentException.class, () -> new CheckCalendarAvailabilityTool().execute(Map.of()));
    }

    @Test
    void doneShouldSucceed() {
        assertTrue(new DoneTool().execute(Map.of("done", true)).join().isSuccess());
    }

    @Test
    void questionShouldEchoContent() {
        assertEquals("Question asked: Which room?",
                new QuestionTool().execute(Map.of("content", "Which room?")).join().getOutput());
    }
}
