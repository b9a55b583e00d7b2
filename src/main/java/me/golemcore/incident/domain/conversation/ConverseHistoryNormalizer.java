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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.domain.conversation.NormalizationDiagnostic.Kind;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.Role;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes histories for backends that require strict user/assistant
 * alternation of tool traffic.
 *
 * <p>
 * Runs three passes over the history:
 * <ol>
 * <li>collect call ids that are both called and answered inside a single tool
 * message (internal pairs);</li>
 * <li>rewrite each message for its effective role: tool turns become user
 * turns, tool messages carrying both calls and results are flattened to text,
 * blocks that cannot appear under the effective role are dropped;</li>
 * <li>drop tool results whose call was not issued by an earlier assistant
 * turn.</li>
 * </ol>
 *
 * <p>
 * System messages are lifted out into
 * {@link ConversationView#systemInstructions()}. Every output block is a new
 * instance; the input list and its messages are left untouched.
 */
@Component
@Slf4j
public class ConverseHistoryNormalizer implements HistoryNormalizer {

    private static final String UNKNOWN = "unknown";

    private final ObjectMapper objectMapper;

    public ConverseHistoryNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ConversationView normalize(List<Message> history) {
        if (history == null || history.isEmpty()) {
            return ConversationView.empty();
        }

        List<NormalizationDiagnostic> diagnostics = new ArrayList<>();
        List<String> systemInstructions = new ArrayList<>();

        Set<String> internalCallIds = findInternalCallIds(history, diagnostics);
        List<Indexed> repaired = repairMessages(history, internalCallIds, systemInstructions, diagnostics);
        List<Message> validated = dropOrphanedResults(repaired, diagnostics);

        if (!diagnostics.isEmpty()) {
            log.debug("[Normalizer] {} message(s) in, {} out, {} change(s): {}",
                    history.size(), validated.size(), diagnostics.size(), diagnostics);
        }
        return new ConversationView(validated, systemInstructions, diagnostics);
    }

    // ==================== Pass 1 ====================

    private Set<String> findInternalCallIds(List<Message> history, List<NormalizationDiagnostic> diagnostics) {
        Set<String> internal = new LinkedHashSet<>();
        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            if (message == null || !message.isToolMessage()) {
                continue;
            }
            Set<String> callIds = new HashSet<>();
            for (ContentBlock.ToolCall call : message.getToolCalls()) {
                if (call.callId() != null) {
                    callIds.add(call.callId());
                }
            }
            for (ContentBlock.ToolResult result : message.getToolResults()) {
                if (result.callId() != null && callIds.contains(result.callId()) && internal.add(result.callId())) {
                    diagnostics.add(new NormalizationDiagnostic(Kind.INTERNAL_TOOL_PAIR, i, result.callId(),
                            "call and result recorded in the same tool message"));
                }
            }
        }
        return internal;
    }

    // ==================== Pass 2 ====================

    private List<Indexed> repairMessages(List<Message> history, Set<String> internalCallIds,
            List<String> systemInstructions, List<NormalizationDiagnostic> diagnostics) {
        List<Indexed> repaired = new ArrayList<>();
        Set<String> filteredCallIds = new HashSet<>();

        for (int i = 0; i < history.size(); i++) {
            Message message = history.get(i);
            if (message == null) {
                continue;
            }

            if (message.isToolMessage() && message.hasToolCalls() && message.hasToolResults()) {
                repaired.add(new Indexed(i, decomposeMixedMessage(message, i, diagnostics)));
                continue;
            }

            Role effectiveRole = message.isToolMessage() ? Role.USER : message.getRole();
            List<ContentBlock> kept;
            if (effectiveRole == Role.ASSISTANT) {
                kept = filterAssistantContent(message, i, filteredCallIds, diagnostics);
            } else if (effectiveRole == Role.USER) {
                kept = filterUserContent(message, i, internalCallIds, filteredCallIds, diagnostics);
            } else {
                kept = copyTextOnly(message);
            }

            if (kept.isEmpty()) {
                diagnostics.add(new NormalizationDiagnostic(Kind.EMPTY_MESSAGE_DROPPED, i, null,
                        message.getRole() + " message has no content left"));
                continue;
            }

            if (effectiveRole == Role.SYSTEM) {
                systemInstructions.add(Message.of(Role.SYSTEM, kept).getText());
                diagnostics.add(new NormalizationDiagnostic(Kind.SYSTEM_EXTRACTED, i, null, null));
                continue;
            }

            repaired.add(new Indexed(i, Message.of(effectiveRole, kept)));
        }
        return repaired;
    }

    private Message decomposeMixedMessage(Message message, int index, List<NormalizationDiagnostic> diagnostics) {
        Set<String> callIdsHere = new HashSet<>();
        for (ContentBlock.ToolCall call : message.getToolCalls()) {
            if (call.callId() != null) {
                callIdsHere.add(call.callId());
            }
        }

        List<ContentBlock> unmatchedResults = new ArrayList<>();
        List<ContentBlock> convertedCalls = new ArrayList<>();
        List<ContentBlock> convertedResults = new ArrayList<>();
        List<ContentBlock> otherText = new ArrayList<>();

        for (ContentBlock block : message.getContents()) {
            if (block instanceof ContentBlock.ToolCall call) {
                convertedCalls.add(ContentBlock.text(renderToolCall(call)));
                diagnostics.add(new NormalizationDiagnostic(Kind.TOOL_CALL_CONVERTED, index, call.callId(),
                        "tool call '" + call.name() + "' rendered as text"));
            } else if (block instanceof ContentBlock.ToolResult result) {
                if (result.callId() != null && callIdsHere.contains(result.callId())) {
                    convertedResults.add(ContentBlock.text(renderToolResult(result)));
                    diagnostics.add(new NormalizationDiagnostic(Kind.TOOL_RESULT_CONVERTED, index,
                            result.callId(), "paired tool result rendered as text"));
                } else {
                    unmatchedResults.add(copyOf(result));
                }
            } else if (block instanceof ContentBlock.Text text) {
                otherText.add(ContentBlock.text(text.text()));
            }
        }

        diagnostics.add(new NormalizationDiagnostic(Kind.MIXED_CONTENT_SPLIT, index, null,
                convertedCalls.size() + " call(s), " + convertedResults.size() + " paired result(s), "
                        + unmatchedResults.size() + " unmatched result(s)"));

        List<ContentBlock> contents = new ArrayList<>(unmatchedResults);
        contents.addAll(otherText);
        contents.addAll(convertedCalls);
        contents.addAll(convertedResults);
        return Message.of(Role.USER, contents);
    }

    private List<ContentBlock> filterAssistantContent(Message message, int index, Set<String> filteredCallIds,
            List<NormalizationDiagnostic> diagnostics) {
        List<ContentBlock> kept = new ArrayList<>();
        for (ContentBlock block : message.getContents()) {
            if (block instanceof ContentBlock.ToolResult result) {
                if (result.callId() != null) {
                    filteredCallIds.add(result.callId());
                }
                diagnostics.add(new NormalizationDiagnostic(Kind.TOOL_RESULT_DROPPED, index, result.callId(),
                        "tool result in assistant turn"));
            } else {
                kept.add(copyOf(block));
            }
        }
        return kept;
    }

    private List<ContentBlock> filterUserContent(Message message, int index, Set<String> internalCallIds,
            Set<String> filteredCallIds, List<NormalizationDiagnostic> diagnostics) {
        List<ContentBlock> kept = new ArrayList<>();
        for (ContentBlock block : message.getContents()) {
            if (block instanceof ContentBlock.ToolCall call) {
                if (call.callId() != null) {
                    filteredCallIds.add(call.callId());
                }
                String detail = call.callId() != null && internalCallIds.contains(call.callId())
                        ? "internal tool call '" + call.name() + "'"
                        : "tool call '" + call.name() + "' in user turn";
                diagnostics.add(new NormalizationDiagnostic(Kind.TOOL_CALL_DROPPED, index, call.callId(), detail));
            } else if (block instanceof ContentBlock.ToolResult result
                    && result.callId() != null && filteredCallIds.contains(result.callId())) {
                diagnostics.add(new NormalizationDiagnostic(Kind.TOOL_RESULT_DROPPED, index, result.callId(),
                        "result of a filtered tool call"));
            } else {
                kept.add(copyOf(block));
            }
        }
        return kept;
    }

    private List<ContentBlock> copyTextOnly(Message message) {
        List<ContentBlock> kept = new ArrayList<>();
        for (ContentBlock block : message.getContents()) {
            if (block instanceof ContentBlock.Text text) {
                kept.add(ContentBlock.text(text.text()));
            }
        }
        return kept;
    }

    // ==================== Pass 3 ====================

    private List<Message> dropOrphanedResults(List<Indexed> repaired, List<NormalizationDiagnostic> diagnostics) {
        List<Message> validated = new ArrayList<>();
        Set<String> availableCallIds = new HashSet<>();

        for (Indexed entry : repaired) {
            Message message = entry.message();
            if (message.isAssistantMessage()) {
                for (ContentBlock.ToolCall call : message.getToolCalls()) {
                    if (call.callId() != null) {
                        availableCallIds.add(call.callId());
                    }
                }
                validated.add(message);
                continue;
            }
            if (!message.isUserMessage() || !message.hasToolResults()) {
                validated.add(message);
                continue;
            }

            List<ContentBlock> kept = new ArrayList<>();
            for (ContentBlock block : message.getContents()) {
                if (block instanceof ContentBlock.ToolResult result
                        && (result.callId() == null || !availableCallIds.contains(result.callId()))) {
                    log.warn("[Normalizer] Dropping orphaned tool result '{}' at message {}",
                            result.callId(), entry.sourceIndex());
                    diagnostics.add(new NormalizationDiagnostic(Kind.ORPHANED_TOOL_RESULT, entry.sourceIndex(),
                            result.callId(), "no preceding assistant tool call"));
                } else {
                    kept.add(block);
                }
            }

            if (kept.isEmpty()) {
                diagnostics.add(new NormalizationDiagnostic(Kind.EMPTY_MESSAGE_DROPPED, entry.sourceIndex(), null,
                        "only orphaned tool results"));
            } else if (kept.size() == message.getContents().size()) {
                validated.add(message);
            } else {
                validated.add(Message.of(Role.USER, kept));
            }
        }
        return validated;
    }

    // ==================== Rendering ====================

    String renderToolCall(ContentBlock.ToolCall call) {
        StringBuilder sb = new StringBuilder("[Tool Call: ")
                .append(call.name() != null ? call.name() : UNKNOWN)
                .append(" (id: ")
                .append(call.callId() != null ? call.callId() : UNKNOWN)
                .append(")]");
        String input = renderArguments(call.arguments());
        if (input != null) {
            sb.append("\nInput: ").append(input);
        }
        return sb.toString();
    }

    String renderToolResult(ContentBlock.ToolResult result) {
        StringBuilder sb = new StringBuilder("[Tool Result for: ")
                .append(result.callId() != null ? result.callId() : UNKNOWN)
                .append("]");
        if (result.result() != null && !result.result().isEmpty()) {
            sb.append("\nOutput: ").append(result.result());
        }
        if (result.error() != null) {
            sb.append("\nError: ").append(result.error());
        }
        return sb.toString();
    }

    private String renderArguments(Object arguments) {
        if (arguments == null
                || arguments instanceof Map<?, ?> map && map.isEmpty()
                || arguments instanceof String s && s.isBlank()) {
            return null;
        }
        try {
            JsonNode tree = arguments instanceof String s
                    ? objectMapper.readTree(s)
                    : objectMapper.valueToTree(arguments);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return String.valueOf(arguments);
        }
    }

    private static ContentBlock copyOf(ContentBlock block) {
        if (block instanceof ContentBlock.Text text) {
            return new ContentBlock.Text(text.text());
        }
        if (block instanceof ContentBlock.ToolCall call) {
            return new ContentBlock.ToolCall(call.callId(), call.name(), call.arguments());
        }
        ContentBlock.ToolResult result = (ContentBlock.ToolResult) block;
        return new ContentBlock.ToolResult(result.callId(), result.result(), result.error());
    }

    private record Indexed(int sourceIndex, Message message) {
    }
}
