package me.golemcore.incident.domain.conversation;

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

import me.golemcore.incident.domain.model.Message;

import java.util.List;

/**
 * Backend-ready view of a conversation.
 *
 * <p>
 * {@code messages} holds only user and assistant turns. System text is carried
 * separately in {@code systemInstructions}.
 */
public record ConversationView(List<Message> messages, List<String> systemInstructions,
        List<NormalizationDiagnostic> diagnostics) {

    public ConversationView {
        messages = messages != null ? List.copyOf(messages) : List.of();
        systemInstructions = systemInstructions != null ? List.copyOf(systemInstructions) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static ConversationView empty() {
        return new ConversationView(List.of(), List.of(), List.of());
    }

    /**
     * Whether any remaining message still carries a tool call or tool result.
     */
    public boolean hasToolContent() {
        return messages.stream().anyMatch(m -> m.hasToolCalls() || m.hasToolResults());
    }
}
