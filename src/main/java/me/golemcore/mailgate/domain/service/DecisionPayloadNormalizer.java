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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.MalformedDecisionException;
import me.golemcore.mailgate.domain.exception.UnknownDecisionTypeException;
import me.golemcore.mailgate.domain.model.Decision;
import me.golemcore.mailgate.domain.model.DecisionType;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the raw payload delivered by the review channel into a
 * {@link Decision}.
 *
 * <p>
 * Accepted shapes:
 * <ul>
 * <li>a list: the first element is the decision</li>
 * <li>an object with a {@code type} field: the decision itself</li>
 * <li>an object without {@code type}: keyed by suspension id, the first value
 * is the decision</li>
 * </ul>
 * Decision elements look like {@code {"type": "edit", "args": {"args": {...}}}}
 * or {@code {"type": "response", "args": "feedback text"}}.
 *
 * <p>
 * Empty, unusable or type-less payloads yield {@link Optional#empty()}, on
 * which the gate runs the tool with its original arguments. A type outside the
 * four known ones is fatal.
 */
@Component
@Slf4j
public class DecisionPayloadNormalizer {

    private static final String TYPE = "type";
    private static final String ARGS = "args";
    private static final String FEEDBACK = "feedback";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DecisionPayloadNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the decision, or empty when the payload carries no usable decision
     * @throws UnknownDecisionTypeException
     *             if the decision names an unrecognized type
     */
    public Optional<Decision> normalize(JsonNode payload) {
        JsonNode element = extractElement(payload);
        if (element == null) {
            log.warn("[Gate] Unusable decision payload: {}", payload);
            return Optional.empty();
        }
        try {
            return Optional.of(parse(element));
        } catch (MalformedDecisionException e) {
            log.warn("[Gate] Malformed decision: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode extractElement(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return null;
        }
        if (payload.isArray()) {
            return payload.isEmpty() ? null : payload.get(0);
        }
        if (!payload.isObject() || payload.isEmpty()) {
            return null;
        }
        if (payload.has(TYPE)) {
            return payload;
        }
        Iterator<JsonNode> values = payload.elements();
        JsonNode first = values.next();
        if (first.isArray()) {
            return first.isEmpty() ? null : first.get(0);
        }
        return first;
    }

    Decision parse(JsonNode element) {
        if (!element.isObject()) {
            throw new MalformedDecisionException("decision is not an object: " + element.getNodeType());
        }
        JsonNode typeNode = element.get(TYPE);
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new MalformedDecisionException("decision has no type");
        }
        String typeName = typeNode.asText();
        DecisionType type = DecisionType.fromWireName(typeName)
                .orElseThrow(() -> new UnknownDecisionTypeException(typeName));

        return switch (type) {
        case ACCEPT -> Decision.accept();
        case EDIT -> Decision.edit(editedArguments(element));
        case IGNORE -> Decision.ignore();
        case RESPOND -> Decision.respond(feedback(element));
        };
    }

    private Map<String, Object> editedArguments(JsonNode element) {
        JsonNode args = element.get(ARGS);
        if (args == null || !args.isObject()) {
            throw new MalformedDecisionException("edit decision has no arguments");
        }
        // The edited call is nested as {"args": {"args": {...}}}; a flat object is
        // taken as the arguments themselves.
        JsonNode nested = args.get(ARGS);
        JsonNode arguments = nested != null && nested.isObject() ? nested : args;
        return objectMapper.convertValue(arguments, MAP_TYPE);
    }

    private String feedback(JsonNode element) {
        JsonNode args = element.get(ARGS);
        if (args != null && args.isTextual()) {
            return args.asText();
        }
        JsonNode feedback = element.get(FEEDBACK);
        if (feedback != null && feedback.isTextual()) {
            return feedback.asText();
        }
        if (args != null && args.isObject() && args.path(FEEDBACK).isTextual()) {
            return args.get(FEEDBACK).asText();
        }
        throw new MalformedDecisionException("response decision has no feedback text");
    }
}
