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
import me.golemcore.mailgate.domain.component.ToolComponent;
import me.golemcore.mailgate.domain.model.ToolDefinition;
import me.golemcore.mailgate.domain.model.ToolFailureKind;
import me.golemcore.mailgate.domain.model.ToolResult;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import me.golemcore.mailgate.port.outbound.ToolExecutorPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Pure tool execution: registry lookup, timeout and result truncation.
 *
 * <p>
 * Does NOT consult review policies and does NOT mutate conversation history.
 * Failures never escape as exceptions; they come back as
 * {@link ToolResult#failure} with a {@link ToolFailureKind}.
 */
@Component
@Slf4j
public class ToolCallExecutionService implements ToolExecutorPort {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();
    private final GateProperties properties;

    public ToolCallExecutionService(List<ToolComponent> tools, GateProperties properties) {
        this.properties = properties;
        for (ToolComponent tool : tools) {
            registerTool(tool);
        }
        log.info("[Tools] Registered {} tools: {}", toolRegistry.size(), toolRegistry.keySet());
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.put(tool.getToolName(), tool);
    }

    public ToolComponent getTool(String name) {
        return toolRegistry.get(name);
    }

    /**
     * Definitions of all enabled tools, sorted by name.
     */
    public List<ToolDefinition> getToolDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        toolRegistry.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(definitions::add);
        return definitions;
    }

    @Override
    public ToolResult execute(String toolName, Map<String, Object> arguments) {
        ToolComponent tool = toolRegistry.get(toolName);

        if (tool == null) {
            String available = String.join(", ", toolRegistry.keySet());
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                    "Unknown tool: " + toolName + ". Available tools: " + available);
        }

        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + toolName);
        }

        try {
            Map<String, Object> args = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
            CompletableFuture<ToolResult> future = tool.execute(args);
            ToolResult result = future.get(properties.getTools().getExecutionTimeoutSeconds(), TimeUnit.SECONDS);
            return truncate(result, toolName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution interrupted");
        } catch (Exception e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private ToolResult truncate(ToolResult result, String toolName) {
        if (result == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        }
        String output = result.getOutput();
        int maxChars = properties.getTools().getMaxResultChars();
        if (output == null || maxChars <= 0 || output.length() <= maxChars) {
            return result;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + output.length() + " chars total, showing first "
                + maxChars + " chars.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, output.length(), cutPoint + suffix.length());
        result.setOutput(output.substring(0, cutPoint) + suffix);
        return result;
    }
}
