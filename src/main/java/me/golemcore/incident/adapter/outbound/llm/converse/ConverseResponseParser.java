package me.golemcore.incident.adapter.outbound.llm.converse;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseContentBlock;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.domain.model.LlmUsage;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.Role;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts a single-shot Converse response into an {@link LlmResponse}.
 */
@Component
@RequiredArgsConstructor
public class ConverseResponseParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public LlmResponse parse(ConverseResponse response, String modelId) {
        List<ContentBlock> contents = new ArrayList<>();
        List<ContentBlock.ToolCall> toolCalls = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        if (response.getOutput() != null && response.getOutput().getMessage() != null
                && response.getOutput().getMessage().getContent() != null) {
            for (ConverseContentBlock block : response.getOutput().getMessage().getContent()) {
                if (block.getText() != null) {
                    text.append(block.getText());
                    contents.add(ContentBlock.text(block.getText()));
                } else if (block.getToolUse() != null) {
                    ConverseContentBlock.ToolUse toolUse = block.getToolUse();
                    ContentBlock.ToolCall call = ContentBlock.toolCall(toolUse.getToolUseId(),
                            toolUse.getName(), toArguments(toolUse.getInput()));
                    contents.add(call);
                    toolCalls.add(call);
                }
            }
        }

        return LlmResponse.builder()
                .message(Message.of(Role.ASSISTANT, contents))
                .content(text.toString())
                .toolCalls(toolCalls)
                .usage(toUsage(response.getUsage(), modelId))
                .model(modelId)
                .finishReason(StopReasons.toFinishReason(response.getStopReason()))
                .build();
    }

    private Map<String, Object> toArguments(JsonNode input) {
        if (input == null || !input.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(input, MAP_TYPE_REF);
    }

    private static LlmUsage toUsage(ConverseResponse.TokenUsage usage, String modelId) {
        if (usage == null) {
            return null;
        }
        int input = usage.getInputTokens() != null ? usage.getInputTokens() : 0;
        int output = usage.getOutputTokens() != null ? usage.getOutputTokens() : 0;
        return LlmUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(usage.getTotalTokens() != null ? usage.getTotalTokens() : input + output)
                .model(modelId)
                .build();
    }
}
