package me.golemcore.incident.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Request object sent to LLM providers containing model selection, messages,
 * system prompt, available tools, and generation parameters.
 */
@Data
@Builder(toBuilder = true)
public class LlmRequest {

    private String model;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    /**
     * Tools re-offered when {@link #tools} is empty but the history still carries
     * tool-use content, which the backend rejects without a tool configuration.
     */
    @Builder.Default
    private List<ToolDefinition> fallbackTools = new ArrayList<>();

    @Builder.Default
    private ToolChoice toolChoice = ToolChoice.AUTO;

    private Double temperature;
    private Integer maxTokens;
    private Double topP;
    private Integer topK;
    private List<String> stopSequences;

    private String sessionId;

    /**
     * Adds a message to the request's conversation history.
     */
    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }

    public GenerationOptions toGenerationOptions() {
        return GenerationOptions.builder()
                .modelId(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .topP(topP)
                .topK(topK)
                .stopSequences(stopSequences)
                .build();
    }
}
