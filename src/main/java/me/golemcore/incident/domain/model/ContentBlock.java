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

/**
 * One unit of message content.
 *
 * <p>
 * A block is either plain text, a tool invocation requested by the model, or
 * the outcome of such an invocation. Calls and results are correlated by
 * {@code callId}.
 */
public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.ToolCall, ContentBlock.ToolResult {

    static Text text(String text) {
        return new Text(text);
    }

    static ToolCall toolCall(String callId, String name, Object arguments) {
        return new ToolCall(callId, name, arguments);
    }

    static ToolResult toolResult(String callId, String result) {
        return new ToolResult(callId, result, null);
    }

    static ToolResult toolError(String callId, String error) {
        return new ToolResult(callId, null, error);
    }

    /**
     * Plain text content. A {@code null} text is stored as empty.
     */
    record Text(String text) implements ContentBlock {
        public Text {
            text = text != null ? text : "";
        }

        public boolean isBlank() {
            return text.isBlank();
        }
    }

    /**
     * Tool invocation. {@code arguments} is either a {@code Map} or a serialized
     * JSON string.
     */
    record ToolCall(String callId, String name, Object arguments) implements ContentBlock {
    }

    /**
     * Tool outcome. At most one of {@code result} and {@code error} is expected to
     * be set.
     */
    record ToolResult(String callId, String result, String error) implements ContentBlock {

        public boolean isError() {
            return error != null;
        }
    }
}
