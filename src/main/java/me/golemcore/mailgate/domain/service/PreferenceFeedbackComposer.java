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

import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the message list handed to the preference synthesizer: the recent
 * conversation followed by one user message stating what the reviewer did.
 */
@Component
public class PreferenceFeedbackComposer {

    private final GateProperties properties;
    private final PromptResources promptResources;
    private final ApprovalDisplayFormatter formatter;

    public PreferenceFeedbackComposer(GateProperties properties, PromptResources promptResources,
            ApprovalDisplayFormatter formatter) {
        this.properties = properties;
        this.promptResources = promptResources;
        this.formatter = formatter;
    }

    public List<Message> forEdit(AgentContext context, String subject, Map<String, Object> initialArgs,
            Map<String, Object> editedArgs) {
        return compose(context, "User edited the " + subject + ". Here is the initial " + subject
                + " generated by the assistant: " + formatter.toPrettyJson(initialArgs)
                + ". Here is the edited " + subject + ": " + formatter.toPrettyJson(editedArgs) + ".");
    }

    public List<Message> forFeedback(AgentContext context, String feedback) {
        return compose(context, "User gave feedback: " + feedback + ". Use this to update the preferences.");
    }

    public List<Message> forIgnore(AgentContext context, String subject) {
        return compose(context, "The user ignored the " + subject
                + ". That means they did not want to act on this email. Update the triage preferences"
                + " to ensure emails of this type are not classified as respond.");
    }

    public List<Message> forRejection(AgentContext context, String subject, String toolName,
            Map<String, Object> originalArgs, String rejectionReason) {
        StringBuilder sb = new StringBuilder();
        sb.append("The user rejected the ").append(subject)
                .append(". That means they did not want this action taken for this email.")
                .append(" Update the triage preferences to ensure emails of this type are not classified as respond.")
                .append("\n\nRejected tool call: ").append(toolName)
                .append("\nArguments: ").append(formatter.toPrettyJson(originalArgs));
        if (rejectionReason != null && !rejectionReason.isBlank()) {
            sb.append("\n\nUser's rejection reason: ").append(rejectionReason);
        }
        return compose(context, sb.toString());
    }

    private List<Message> compose(AgentContext context, String feedback) {
        List<Message> messages = new ArrayList<>(context.recentMessages(properties.getMemory().getContextMessages()));
        messages.add(Message.user(withReinforcement(feedback)));
        return messages;
    }

    private String withReinforcement(String feedback) {
        if (!properties.getMemory().isReinforcementEnabled()) {
            return feedback;
        }
        String reinforcement = promptResources.memoryUpdateReinforcement();
        if (reinforcement.isBlank()) {
            return feedback;
        }
        return feedback + " Follow all instructions above, and remember: " + reinforcement;
    }
}
