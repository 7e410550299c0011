package me.golemcore.mailgate.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.SynthesizerException;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.domain.service.PromptResources;
import me.golemcore.mailgate.port.outbound.PreferenceSynthesizerPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites a preference profile with the configured chat model.
 *
 * <p>
 * The memory update instructions go into the system message together with the
 * current profile. The recent conversation and the feedback are flattened
 * into one user message, so tool messages never reach the provider without
 * their proposing call. The model answers
 * {@code {"chain_of_thought": ..., "user_preferences": ...}}; a plain-text
 * answer is taken as the profile itself.
 */
@Component
@ConditionalOnExpression("'${gate.llm.provider:none}' != 'none'")
@Slf4j
public class Langchain4jPreferenceSynthesizer implements PreferenceSynthesizerPort {

    private static final String FIELD_PREFERENCES = "user_preferences";
    private static final String FIELD_REASONING = "chain_of_thought";

    private final ChatModelFactory modelFactory;
    private final PromptResources promptResources;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    public Langchain4jPreferenceSynthesizer(ChatModelFactory modelFactory, PromptResources promptResources,
            ObjectMapper objectMapper) {
        this.modelFactory = modelFactory;
        this.promptResources = promptResources;
        this.objectMapper = objectMapper;
    }

    @Override
    public String synthesize(MemoryNamespace namespace, String currentProfile, List<Message> feedbackMessages) {
        String instructions = promptResources.memoryUpdateInstructions()
                .replace("{namespace}", namespace.toString())
                .replace("{current_profile}", currentProfile);

        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(instructions), UserMessage.from(transcript(feedbackMessages))))
                .build();

        ChatResponse response;
        try {
            response = model().chat(request);
        } catch (RuntimeException e) {
            throw new SynthesizerException("Model call failed for " + namespace + ": " + e.getMessage(), e);
        }
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw new SynthesizerException("Model returned no profile for " + namespace);
        }
        return extractProfile(text);
    }

    String extractProfile(String text) {
        String json = stripCodeFence(text.strip());
        if (!json.startsWith("{")) {
            return text.strip();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode preferences = node.get(FIELD_PREFERENCES);
            if (preferences == null || !preferences.isTextual()) {
                throw new SynthesizerException("Structured answer has no " + FIELD_PREFERENCES);
            }
            if (node.hasNonNull(FIELD_REASONING)) {
                log.debug("[Memory] Synthesizer reasoning: {}", node.get(FIELD_REASONING).asText());
            }
            return preferences.asText();
        } catch (JsonProcessingException e) {
            log.debug("[Memory] Answer is not JSON, using it verbatim");
            return text.strip();
        }
    }

    static String transcript(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        for (Message msg : messages) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(msg.getRole());
            if (msg.isToolMessage() && msg.getToolName() != null) {
                sb.append(" (").append(msg.getToolName()).append(')');
            }
            sb.append(": ");
            if (msg.getContent() != null) {
                sb.append(msg.getContent());
            }
            if (msg.hasToolCalls()) {
                for (Message.ToolCall call : msg.getToolCalls()) {
                    sb.append("\n[tool call ").append(call.getName()).append("] ").append(call.getArguments());
                }
            }
        }
        return sb.toString();
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).strip();
    }

    private ChatModel model() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = modelFactory.create();
                }
                model = chatModel;
            }
        }
        return model;
    }
}
