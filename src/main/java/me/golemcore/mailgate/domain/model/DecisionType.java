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

import java.util.Locale;
import java.util.Optional;

/**
 * The four ways a reviewer can resolve a held tool call, with the names used
 * on the wire.
 */
public enum DecisionType {

    ACCEPT("accept"),

    EDIT("edit"),

    IGNORE("ignore"),

    RESPOND("response");

    private final String wireName;

    DecisionType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire name. {@code "respond"} is accepted as an alias of
     * {@code "response"}.
     */
    public static Optional<DecisionType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("respond".equals(normalized)) {
            return Optional.of(RESPOND);
        }
        for (DecisionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
