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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured outcome of a review. Closed set of four variants; callers dispatch
 * on {@link #type()}.
 */
public sealed interface Decision permits Decision.Accept, Decision.Edit, Decision.Ignore, Decision.Respond {

    DecisionType type();

    static Decision accept() {
        return new Accept();
    }

    static Decision edit(Map<String, Object> arguments) {
        return new Edit(arguments);
    }

    static Decision ignore() {
        return new Ignore();
    }

    static Decision respond(String feedback) {
        return new Respond(feedback);
    }

    /** Execute with the proposed arguments. */
    record Accept() implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.ACCEPT;
        }
    }

    /** Execute with replacement arguments. */
    record Edit(Map<String, Object> arguments) implements Decision {
        public Edit {
            arguments = arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<>();
        }

        @Override
        public DecisionType type() {
            return DecisionType.EDIT;
        }
    }

    /** Skip the call and end the run. */
    record Ignore() implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.IGNORE;
        }
    }

    /** Skip the call and hand the reviewer's text back to the model. */
    record Respond(String feedback) implements Decision {
        public Respond {
            Objects.requireNonNull(feedback, "feedback");
        }

        @Override
        public DecisionType type() {
            return DecisionType.RESPOND;
        }
    }
}
