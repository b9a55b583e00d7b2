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

/**
 * Incremental update of a streamed response: a text fragment, a completed tool
 * call, or the final finish signal.
 */
@Value
@Builder
public class LlmChunk {

    String text;
    ContentBlock.ToolCall toolCall;
    FinishReason finishReason;
    boolean done;
    LlmUsage usage;

    public static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    public static LlmChunk toolCall(ContentBlock.ToolCall toolCall) {
        return LlmChunk.builder().toolCall(toolCall).build();
    }

    public static LlmChunk finish(FinishReason finishReason, LlmUsage usage) {
        return LlmChunk.builder()
                .finishReason(finishReason)
                .done(true)
                .usage(usage)
                .build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
