package me.golemcore.mailgate.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gate, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code gate.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - persistence of profiles, approvals and run
 * checkpoints</li>
 * <li>{@link ApprovalProperties} - which tools are held for review</li>
 * <li>{@link ToolsProperties} - per-tool review policies and execution
 * limits</li>
 * <li>{@link MemoryProperties} - preference update behavior</li>
 * <li>{@link ReconcilerProperties} - rejection reconciliation watch set</li>
 * <li>{@link LlmProperties} - model provider used by the loop and the
 * preference synthesizer</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "gate")
@Data
public class GateProperties {

    public static final String TOOL_WRITE_EMAIL = "write_email";
    public static final String TOOL_SCHEDULE_MEETING = "schedule_meeting";
    public static final String TOOL_QUESTION = "Question";

    private StorageProperties storage = new StorageProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private ToolsProperties tools = new ToolsProperties();
    private MemoryProperties memory = new MemoryProperties();
    private ReconcilerProperties reconciler = new ReconcilerProperties();
    private LoopProperties loop = new LoopProperties();
    private RunsProperties runs = new RunsProperties();
    private LlmProperties llm = new LlmProperties();
    private PromptsProperties prompts = new PromptsProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/mail-gate";
    }

    // ==================== APPROVAL ====================

    @Data
    public static class ApprovalProperties {
        /**
         * Tool name -> whether calls to it are held for human review. Tools missing
         * from this map run without review.
         */
        private Map<String, Boolean> interruptOn = defaultInterruptOn();

        /**
         * How long a run waits for a decision. {@link Duration#ZERO} waits
         * indefinitely.
         */
        private Duration timeout = Duration.ZERO;

        private static Map<String, Boolean> defaultInterruptOn() {
            Map<String, Boolean> map = new LinkedHashMap<>();
            map.put(TOOL_WRITE_EMAIL, true);
            map.put(TOOL_SCHEDULE_MEETING, true);
            map.put(TOOL_QUESTION, true);
            return map;
        }
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Map<String, ToolPolicyProperties> policies = defaultPolicies();
        private int executionTimeoutSeconds = 30;
        private int maxResultChars = 20000;

        private static Map<String, ToolPolicyProperties> defaultPolicies() {
            Map<String, ToolPolicyProperties> map = new LinkedHashMap<>();
            map.put(TOOL_WRITE_EMAIL, ToolPolicyProperties.of("email draft",
                    "email_assistant/response_preferences", true, false));
            map.put(TOOL_SCHEDULE_MEETING, ToolPolicyProperties.of("calendar meeting draft",
                    "email_assistant/cal_preferences", true, false));
            map.put(TOOL_QUESTION, ToolPolicyProperties.of("question", null, false, true));
            return map;
        }
    }

    @Data
    public static class ToolPolicyProperties {
        private boolean allowAccept = true;
        private boolean allowEdit = true;
        private boolean allowIgnore = true;
        private boolean allowRespond = true;

        /** Preference namespace path ("a/b") updated on edit/respond. */
        private String memoryNamespace;

        /** Short label used in messages, e.g. "email draft". */
        private String subject = "tool call";

        /** Respond feedback is an answer rather than a revision request. */
        private boolean answersQuestion = false;

        static ToolPolicyProperties of(String subject, String memoryNamespace, boolean editable,
                boolean answersQuestion) {
            ToolPolicyProperties props = new ToolPolicyProperties();
            props.setSubject(subject);
            props.setMemoryNamespace(memoryNamespace);
            props.setAllowAccept(editable);
            props.setAllowEdit(editable);
            props.setAnswersQuestion(answersQuestion);
            return props;
        }
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /**
         * Number of most recent conversation messages passed to the synthesizer along
         * with the feedback sentence.
         */
        private int contextMessages = 20;

        /** Append the "never overwrite" reminder to every feedback sentence. */
        private boolean reinforcementEnabled = true;

        private String triageNamespace = "email_assistant/triage_preferences";
        private String responseNamespace = "email_assistant/response_preferences";
        private String calendarNamespace = "email_assistant/cal_preferences";
    }

    // ==================== RECONCILER ====================

    @Data
    public static class ReconcilerProperties {
        private boolean enabled = true;
        private List<String> watchedTools = new ArrayList<>(List.of(TOOL_WRITE_EMAIL, TOOL_SCHEDULE_MEETING));
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxIterations = 25;

        /** Tools whose successful execution ends the run. */
        private List<String> terminalTools = new ArrayList<>(List.of("Done"));
    }

    @Data
    public static class RunsProperties {
        private int maxConcurrent = 4;

        /** Replay runs that were suspended at a review when the process stopped. */
        private boolean resumeOnStartup = true;
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** none, openai or anthropic. */
        private String provider = "none";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(60);
        private double temperature = 0.0;
        private int maxTokens = 4096;
    }

    @Data
    public static class PromptsProperties {
        private String background = "I'm a software engineer. Keep my inbox under control.";
    }
}
