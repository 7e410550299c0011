package me.golemcore.mailgate.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defines a function/tool that the LLM can call during a run. Contains the tool
 * name, description, and JSON Schema for input parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a definition whose parameters are all required strings.
     *
     * @param name
     *            tool name as seen by the model
     * @param description
     *            tool description as seen by the model
     * @param parameters
     *            parameter name -> description, in declaration order
     */
    public static ToolDefinition withStringParameters(String name, String description,
            Map<String, String> parameters) {
        Map<String, Object> properties = new LinkedHashMap<>();
        parameters.forEach((param, paramDescription) -> properties.put(param,
                Map.of("type", "string", "description", paramDescription)));
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.copyOf(parameters.keySet())))
                .build();
    }
}
