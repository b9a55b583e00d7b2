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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseContentBlock;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseMessage;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.domain.conversation.ConversationView;
import me.golemcore.incident.domain.conversation.HistoryNormalizer;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.GenerationOptions;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.ToolChoice;
import me.golemcore.incident.domain.model.ToolDefinition;
import me.golemcore.incident.domain.service.ToolSchemaBuilder;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Encodes a conversation into a Converse request body.
 *
 * <p>
 * The history is normalized first, so the encoder only ever sees user and
 * assistant turns with well-formed tool pairing. System text goes to the
 * {@code system} field. Tools pass through {@link ToolSchemaBuilder}, so a
 * tool that cannot be described is left out of the request. The output token
 * limit is never below the configured floor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConverseRequestEncoder {

    private static final String ROLE_USER = "user";
    private static final String ROLE_ASSISTANT = "assistant";
    private static final String STATUS_ERROR = "error";

    private final HistoryNormalizer historyNormalizer;
    private final ToolSchemaBuilder toolSchemaBuilder;
    private final ObjectMapper objectMapper;
    private final IncidentProperties properties;

    /**
     * Encodes a full request. The request's system prompt, when set, is placed
     * ahead of any system messages in the history.
     */
    public ConverseRequest encode(LlmRequest request, String defaultModelId) {
        List<Message> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(Message.system(request.getSystemPrompt()));
        }
        if (request.getMessages() != null) {
            messages.addAll(request.getMessages());
        }

        GenerationOptions options = request.toGenerationOptions();
        if (options.getModelId() == null || options.getModelId().isBlank()) {
            options = options.toBuilder().modelId(defaultModelId).build();
        }
        return encode(messages, request.getTools(), request.getToolChoice(), options, request.getFallbackTools());
    }

    public ConverseRequest encode(List<Message> messages, List<ToolDefinition> tools, ToolChoice toolChoice,
            GenerationOptions options) {
        return encode(messages, tools, toolChoice, options, List.of());
    }

    /**
     * Encodes a conversation.
     *
     * @param fallbackTools
     *            offered with {@code auto} choice when {@code tools} is empty but
     *            the normalized history still holds tool content
     */
    public ConverseRequest encode(List<Message> messages, List<ToolDefinition> tools, ToolChoice toolChoice,
            GenerationOptions options, List<ToolDefinition> fallbackTools) {
        GenerationOptions effectiveOptions = options != null ? options : GenerationOptions.defaults();
        ConversationView view = historyNormalizer.normalize(messages);

        List<ConverseMessage> encodedMessages = new ArrayList<>();
        for (Message message : view.messages()) {
            List<ConverseContentBlock> content = encodeContents(message);
            if (!content.isEmpty()) {
                encodedMessages.add(ConverseMessage.builder()
                        .role(message.isAssistantMessage() ? ROLE_ASSISTANT : ROLE_USER)
                        .content(content)
                        .build());
            }
        }

        List<ToolDefinition> effectiveTools = describeTools(tools);
        ToolChoice effectiveChoice = toolChoice;
        if (effectiveTools.isEmpty() && view.hasToolContent()) {
            List<ToolDefinition> fallback = describeTools(fallbackTools);
            if (!fallback.isEmpty()) {
                log.debug("[Converse] History has tool content but no tools offered, reusing {} fallback tool(s)",
                        fallback.size());
                effectiveTools = fallback;
                effectiveChoice = ToolChoice.AUTO;
            } else {
                log.warn("[Converse] History has tool content but no tools are configured, "
                        + "the backend may reject the request");
            }
        }

        return ConverseRequest.builder()
                .modelId(effectiveOptions.getModelId())
                .messages(encodedMessages)
                .system(encodeSystem(view.systemInstructions()))
                .inferenceConfig(encodeInferenceConfig(effectiveOptions))
                .toolConfig(encodeToolConfig(effectiveTools, effectiveChoice))
                .additionalModelRequestFields(effectiveOptions.getTopK() != null
                        ? Map.of("top_k", effectiveOptions.getTopK())
                        : null)
                .build();
    }

    private List<ToolDefinition> describeTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        ToolSchemaBuilder.ToolSchemaResult result = toolSchemaBuilder.buildAll(tools);
        if (result.hasDropped()) {
            log.warn("[Converse] Sending {} of {} tool(s), excluded: {}", result.tools().size(), tools.size(),
                    result.dropped().stream().map(ToolSchemaBuilder.DroppedTool::name).toList());
        }
        return result.tools();
    }

    private List<ConverseRequest.SystemContent> encodeSystem(List<String> instructions) {
        List<ConverseRequest.SystemContent> system = new ArrayList<>();
        for (String instruction : instructions) {
            if (instruction != null && !instruction.isBlank()) {
                system.add(new ConverseRequest.SystemContent(instruction));
            }
        }
        return system.isEmpty() ? null : system;
    }

    private List<ConverseContentBlock> encodeContents(Message message) {
        List<ConverseContentBlock> content = new ArrayList<>();
        for (ContentBlock block : message.getContents()) {
            if (block instanceof ContentBlock.Text text) {
                // Converse rejects blank text blocks
                if (!text.isBlank()) {
                    content.add(ConverseContentBlock.text(text.text()));
                }
            } else if (block instanceof ContentBlock.ToolCall call) {
                content.add(ConverseContentBlock.builder()
                        .toolUse(ConverseContentBlock.ToolUse.builder()
                                .toolUseId(call.callId())
                                .name(call.name())
                                .input(toInput(call))
                                .build())
                        .build());
            } else if (block instanceof ContentBlock.ToolResult result) {
                content.add(ConverseContentBlock.builder()
                        .toolResult(encodeToolResult(result))
                        .build());
            }
        }
        return content;
    }

    private ConverseContentBlock.ToolResult encodeToolResult(ContentBlock.ToolResult result) {
        String text;
        if (result.result() != null) {
            text = result.result();
        } else if (result.error() != null) {
            text = result.error();
        } else {
            text = "";
        }
        return ConverseContentBlock.ToolResult.builder()
                .toolUseId(result.callId())
                .content(List.of(new ConverseContentBlock.ToolResultContent(text)))
                .status(result.isError() ? STATUS_ERROR : null)
                .build();
    }

    private JsonNode toInput(ContentBlock.ToolCall call) {
        Object arguments = call.arguments();
        if (arguments == null) {
            return objectMapper.createObjectNode();
        }
        if (arguments instanceof String json) {
            if (json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                log.warn("[Converse] Tool call '{}' ({}) has unparseable arguments, sending empty input",
                        call.name(), call.callId());
                return objectMapper.createObjectNode();
            }
        }
        return objectMapper.valueToTree(arguments);
    }

    private ConverseRequest.InferenceConfig encodeInferenceConfig(GenerationOptions options) {
        int floor = properties.getLlm().getConverse().getMinMaxTokens();
        Integer requested = options.getMaxTokens();
        int maxTokens = requested == null || requested < floor ? floor : requested;

        List<String> stopSequences = options.getStopSequences();
        return ConverseRequest.InferenceConfig.builder()
                .maxTokens(maxTokens)
                .temperature(options.getTemperature())
                .topP(options.getTopP())
                .stopSequences(stopSequences != null && !stopSequences.isEmpty() ? stopSequences : null)
                .build();
    }

    private ConverseRequest.ToolConfig encodeToolConfig(List<ToolDefinition> tools, ToolChoice toolChoice) {
        if (tools == null || tools.isEmpty()) {
            return null;
        }
        List<ConverseRequest.Tool> encoded = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            encoded.add(new ConverseRequest.Tool(ConverseRequest.ToolSpec.builder()
                    .name(tool.getName())
                    .description(tool.getDescription())
                    .inputSchema(new ConverseRequest.InputSchema(tool.getInputSchema()))
                    .build()));
        }
        return ConverseRequest.ToolConfig.builder()
                .tools(encoded)
                .toolChoice(encodeToolChoice(toolChoice))
                .build();
    }

    private static ConverseRequest.ToolChoice encodeToolChoice(ToolChoice toolChoice) {
        ToolChoice choice = toolChoice != null ? toolChoice : ToolChoice.AUTO;
        switch (choice.mode()) {
        case ANY:
            return ConverseRequest.ToolChoice.any();
        case NONE:
            return ConverseRequest.ToolChoice.none();
        case TOOL:
            return ConverseRequest.ToolChoice.tool(choice.toolName());
        default:
            return ConverseRequest.ToolChoice.auto();
        }
    }
}
