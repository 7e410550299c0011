package me.golemcore.mailgate.port.outbound;

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

import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;

import java.util.List;

/**
 * Port for rewriting a preference profile from new evidence.
 *
 * <p>
 * Implementations must merge additively: the returned profile may add facts or
 * amend facts the feedback contradicts, but keeps every unrelated line of the
 * current profile.
 */
public interface PreferenceSynthesizerPort {

    /**
     * @param namespace
     *            the profile being rewritten
     * @param currentProfile
     *            the stored profile, or the namespace default if never written
     * @param feedbackMessages
     *            recent conversation followed by the feedback sentence
     * @return the new profile text
     */
    String synthesize(MemoryNamespace namespace, String currentProfile, List<Message> feedbackMessages);
}
