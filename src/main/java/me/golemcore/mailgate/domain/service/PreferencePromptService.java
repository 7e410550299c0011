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
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the system prompt for a model turn, with the current triage, response
 * and calendar profiles rendered into it.
 */
@Service
@Slf4j
public class PreferencePromptService {

    private final PreferenceStoreService preferenceStore;
    private final PromptResources promptResources;
    private final GateProperties properties;
    private final Clock clock;

    public PreferencePromptService(PreferenceStoreService preferenceStore, PromptResources promptResources,
            GateProperties properties, Clock clock) {
        this.preferenceStore = preferenceStore;
        this.promptResources = promptResources;
        this.properties = properties;
        this.clock = clock;
    }

    public String buildSystemPrompt(List<ToolDefinition> tools) {
        GateProperties.MemoryProperties memory = properties.getMemory();
        Map<String, String> values = Map.of(
                "tools", tools.stream()
                        .map(tool -> "- " + tool.getName() + ": " + tool.getDescription())
                        .collect(Collectors.joining("\n")),
                "today", LocalDate.now(clock).toString(),
                "background", properties.getPrompts().getBackground(),
                "triage_preferences", profile(memory.getTriageNamespace()),
                "response_preferences", profile(memory.getResponseNamespace()),
                "cal_preferences", profile(memory.getCalendarNamespace()));
        return render(promptResources.agentSystemTemplate(), values);
    }

    private String profile(String namespacePath) {
        MemoryNamespace namespace = MemoryNamespace.parse(namespacePath);
        try {
            return preferenceStore.getProfile(namespace);
        } catch (StoreUnavailableException e) {
            log.error("[Memory] Could not read {}, using default", namespace, e);
            return promptResources.defaultProfile(namespace);
        }
    }

    static String render(String template, Map<String, String> values) {
        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue() != null ? entry.getValue() : "");
        }
        return result;
    }
}
