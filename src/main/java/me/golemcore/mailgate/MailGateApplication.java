package me.golemcore.mailgate;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Mail Gate.
 *
 * <p>
 * Mail Gate runs an email assistant agent whose sensitive tool calls (sending
 * an email, scheduling a meeting, asking the user a question) are held for
 * human review. Every review decision is fed back into per-topic preference
 * profiles that steer the assistant on its next runs.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (runs, approvals, preferences)
 * Domain Layer       → AgentLoop, ApprovalGateService, RejectionReconciler, PreferenceStoreService
 * Infrastructure     → LLM/Storage/Approval adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code gate.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MailGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailGateApplication.class, args);
    }

}
