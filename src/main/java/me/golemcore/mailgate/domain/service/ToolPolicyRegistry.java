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

import me.golemcore.mailgate.domain.exception.PolicyNotFoundException;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.ToolPolicy;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the review policy of a tool from {@code gate.approval.interrupt-on}
 * and {@code gate.tools.policies}.
 *
 * <p>
 * A tool that is not marked for interruption has no policy and runs without
 * review. A tool marked for interruption without a policy entry is a
 * configuration error and fails loudly rather than running unreviewed.
 */
@Component
public class ToolPolicyRegistry {

    private final GateProperties properties;

    public ToolPolicyRegistry(GateProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the policy, or empty when the tool is not held for review
     * @throws PolicyNotFoundException
     *             if the tool is held for review but has no policy
     */
    public Optional<ToolPolicy> resolve(String toolName) {
        if (!requiresApproval(toolName)) {
            return Optional.empty();
        }
        GateProperties.ToolPolicyProperties config = properties.getTools().getPolicies().get(toolName);
        if (config == null) {
            throw new PolicyNotFoundException(toolName);
        }
        return Optional.of(toPolicy(toolName, config));
    }

    public boolean requiresApproval(String toolName) {
        Map<String, Boolean> interruptOn = properties.getApproval().getInterruptOn();
        return toolName != null && interruptOn != null && Boolean.TRUE.equals(interruptOn.get(toolName));
    }

    /**
     * Human label for a tool, as used in synthetic messages. Falls back to the
     * tool name for tools without a policy entry.
     */
    public String subjectOf(String toolName) {
        GateProperties.ToolPolicyProperties config = properties.getTools().getPolicies().get(toolName);
        if (config == null || config.getSubject() == null || config.getSubject().isBlank()) {
            return toolName;
        }
        return config.getSubject();
    }

    private ToolPolicy toPolicy(String toolName, GateProperties.ToolPolicyProperties config) {
        String namespacePath = config.getMemoryNamespace();
        return ToolPolicy.builder()
                .toolName(toolName)
                .requiresApproval(true)
                .allowAccept(config.isAllowAccept())
                .allowEdit(config.isAllowEdit())
                .allowIgnore(config.isAllowIgnore())
                .allowRespond(config.isAllowRespond())
                .memoryNamespace(namespacePath != null && !namespacePath.isBlank()
                        ? MemoryNamespace.parse(namespacePath)
                        : null)
                .subject(config.getSubject())
                .answersQuestion(config.isAnswersQuestion())
                .build();
    }
}
