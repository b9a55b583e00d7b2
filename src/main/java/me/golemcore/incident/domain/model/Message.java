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
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable conversation turn made of a role and an ordered list of content
 * blocks.
 *
 * <p>
 * The content list is copied on construction; {@code null} blocks are skipped.
 */
@Value
public class Message {

    Role role;
    List<ContentBlock> contents;

    @Builder(toBuilder = true)
    private Message(Role role, List<ContentBlock> contents) {
        this.role = Objects.requireNonNull(role, "role");
        this.contents = contents == null
                ? List.of()
                : contents.stream().filter(Objects::nonNull).toList();
    }

    public static Message of(Role role, ContentBlock... contents) {
        return new Message(role, Arrays.asList(contents));
    }

    public static Message of(Role role, List<ContentBlock> contents) {
        return new Message(role, contents);
    }

    public static Message system(String text) {
        return of(Role.SYSTEM, ContentBlock.text(text));
    }

    public static Message user(String text) {
        return of(Role.USER, ContentBlock.text(text));
    }

    public static Message assistant(String text) {
        return of(Role.ASSISTANT, ContentBlock.text(text));
    }

    public boolean isUserMessage() {
        return role == Role.USER;
    }

    public boolean isAssistantMessage() {
        return role == Role.ASSISTANT;
    }

    public boolean isSystemMessage() {
        return role == Role.SYSTEM;
    }

    public boolean isToolMessage() {
        return role == Role.TOOL;
    }

    public boolean isEmpty() {
        return contents.isEmpty();
    }

    public boolean hasToolCalls() {
        return contents.stream().anyMatch(ContentBlock.ToolCall.class::isInstance);
    }

    public boolean hasToolResults() {
        return contents.stream().anyMatch(ContentBlock.ToolResult.class::isInstance);
    }

    public List<ContentBlock.ToolCall> getToolCalls() {
        List<ContentBlock.ToolCall> calls = new ArrayList<>();
        for (ContentBlock block : contents) {
            if (block instanceof ContentBlock.ToolCall call) {
                calls.add(call);
            }
        }
        return calls;
    }

    public List<ContentBlock.ToolResult> getToolResults() {
        List<ContentBlock.ToolResult> results = new ArrayList<>();
        for (ContentBlock block : contents) {
            if (block instanceof ContentBlock.ToolResult result) {
                results.add(result);
            }
        }
        return results;
    }

    /**
     * Concatenates all text blocks, in order, without separators.
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : contents) {
            if (block instanceof ContentBlock.Text text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }
}
