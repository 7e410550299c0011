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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.port.outbound.PreferenceSynthesizerPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Synthesizer used when no LLM is configured: keeps the profile unchanged.
 */
@Component
@ConditionalOnProperty(prefix = "gate.llm", name = "provider", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpPreferenceSynthesizer implements PreferenceSynthesizerPort {

    @Override
    public String synthesize(MemoryNamespace namespace, String currentProfile, List<Message> feedbackMessages) {
        log.debug("[Memory] No LLM configured, keeping {} unchanged ({} feedback messages)", namespace,
                feedbackMessages.size());
        return currentProfile;
    }
}
