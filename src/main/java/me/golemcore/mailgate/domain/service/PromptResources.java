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
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt texts shipped on the classpath under {@code prompts/}: the agent
 * system prompt template, the memory update instructions and the default
 * profile of each preference namespace ({@code prompts/defaults/<leaf>.md}).
 */
@Component
@Slf4j
public class PromptResources {

    private static final String PROMPTS_DIR = "prompts/";
    private static final String DEFAULTS_DIR = PROMPTS_DIR + "defaults/";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public String defaultProfile(MemoryNamespace namespace) {
        return load(DEFAULTS_DIR + namespace.leaf() + ".md");
    }

    public String memoryUpdateInstructions() {
        return load(PROMPTS_DIR + "memory-update-instructions.md");
    }

    public String memoryUpdateReinforcement() {
        return load(PROMPTS_DIR + "memory-update-reinforcement.md");
    }

    public String agentSystemTemplate() {
        return load(PROMPTS_DIR + "agent-system.md");
    }

    /**
     * Loads a classpath text resource. Missing resources read as an empty string.
     */
    String load(String location) {
        return cache.computeIfAbsent(location, this::read);
    }

    private String read(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.debug("[Prompts] No resource at {}", location);
            return "";
        }
        try (InputStream is = resource.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.warn("[Prompts] Failed to read {}: {}", location, e.getMessage());
            return "";
        }
    }
}
