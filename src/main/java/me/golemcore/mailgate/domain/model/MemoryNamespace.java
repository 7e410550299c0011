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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered tuple of segments naming one partition of the preference store, e.g.
 * {@code ("email_assistant", "response_preferences")}.
 */
public record MemoryNamespace(List<String> segments) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String SEPARATOR = "/";

    public MemoryNamespace {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Namespace must have at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || !SEGMENT.matcher(segment).matches() || "..".equals(segment)) {
                throw new IllegalArgumentException("Invalid namespace segment: " + segment);
            }
        }
        segments = List.copyOf(segments);
    }

    public static MemoryNamespace of(String... segments) {
        return new MemoryNamespace(Arrays.asList(segments));
    }

    /**
     * Parses a slash-separated path such as {@code "email_assistant/cal_preferences"}.
     */
    public static MemoryNamespace parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Namespace path is blank");
        }
        return new MemoryNamespace(Arrays.asList(path.trim().split(SEPARATOR)));
    }

    @JsonIgnore
    public String path() {
        return String.join(SEPARATOR, segments);
    }

    @JsonIgnore
    public String leaf() {
        return segments.get(segments.size() - 1);
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", segments) + ")";
    }
}
