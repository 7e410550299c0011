package me.golemcore.mailgate.domain.service;

import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PreferencePromptServiceTest {

    private PreferenceStoreService preferenceStore;
    private PreferencePromptService service;

    @BeforeEach
    void setUp() {
        preferenceStore = mock(PreferenceStoreService.class);
        GateProperties properties = new GateProperties();
        properties.getPrompts().setBackground("I run the platform team.");
        service = new PreferencePromptService(preferenceStore, new PromptResources(), properties,
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldRenderProfilesIntoSystemPrompt() {
        when(preferenceStore.getProfile(any(MemoryNamespace.class))).thenAnswer(invocation -> {
            MemoryNamespace ns = invocation.getArgument(0);
            return "PROFILE<" + ns.leaf() + ">";
        });

        String prompt = service.buildSystemPrompt(List.of(
                ToolDefinition.builder().name("write_email").description("Write and send an email.").build()));

        assertTrue(prompt.contains("PROFILE<triage_preferences>"));
        assertTrue(prompt.contains("PROFILE<response_preferences>"));
        assertTrue(prompt.contains("PROFILE<cal_preferences>"));
        assertTrue(prompt.contains("- write_email: Write and send an email."));
        assertTrue(prompt.contains("2026-03-02"));
        assertTrue(prompt.contains("I run the platform team."));
        assertFalse(prompt.contains("{triage_preferences}"));
    }

    @Test
    void shouldUseDefaultProfileWhenStoreIsUnavailable() {
        when(preferenceStore.getProfile(any(MemoryNamespace.class)))
                .thenThrow(new StoreUnavailableException("down", new RuntimeException()));

        String prompt = service.buildSystemPrompt(List.of());

        assertTrue(prompt.contains("30 minute meetings are preferred"));
    }

    @Test
    void shouldReplaceEveryPlaceholderOccurrence() {
        assertEquals("a-b a", PreferencePromptService.render("{x}-{y} {x}", Map.of("x", "a", "y", "b")));
    }
}
