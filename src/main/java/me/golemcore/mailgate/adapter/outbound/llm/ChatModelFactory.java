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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds the langchain4j chat model for {@code gate.llm.*}. Anthropic gets its
 * native client; every other provider is treated as OpenAI-compatible.
 */
@Component
@Slf4j
public class ChatModelFactory {

    static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String PROVIDER_OPENAI = "openai";

    private final GateProperties properties;

    public ChatModelFactory(GateProperties properties) {
        this.properties = properties;
    }

    public String getProvider() {
        String provider = properties.getLlm().getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : "none";
    }

    public String getModelName() {
        return properties.getLlm().getModel();
    }

    public ChatModel create() {
        GateProperties.LlmProperties config = properties.getLlm();
        String provider = getProvider();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("gate.llm.api-key is not set for provider " + provider);
        }
        log.info("[LLM] Creating {} model {}", provider, config.getModel());
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(config);
        }
        return createOpenAiModel(config);
    }

    private ChatModel createAnthropicModel(GateProperties.LlmProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(GateProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
