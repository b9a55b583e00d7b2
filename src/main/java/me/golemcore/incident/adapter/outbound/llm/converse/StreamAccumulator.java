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

import lombok.Getter;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmUsage;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-stream state: partial content blocks keyed by block index, plus the
 * finish reason and usage once known.
 *
 * <p>
 * Lifecycle: {@code IDLE -> ACCUMULATING -> DONE}, or {@code ERRORED} on a
 * transport failure or cancellation. Not thread-safe; one instance serves one
 * subscription.
 */
public class StreamAccumulator {

    public enum State {
        IDLE, ACCUMULATING, DONE, ERRORED
    }

    private final Map<Integer, PartialBlock> blocks = new TreeMap<>();

    @Getter
    private State state = State.IDLE;
    @Getter
    private FinishReason finishReason;
    @Getter
    private LlmUsage usage;

    void startToolUse(int index, String toolUseId, String name) {
        PartialBlock block = block(index);
        block.toolUse = true;
        block.toolUseId = toolUseId;
        block.name = name;
    }

    void startText(int index) {
        block(index);
    }

    void appendText(int index, String text) {
        block(index).text.append(text);
    }

    void appendToolInput(int index, String fragment) {
        PartialBlock block = block(index);
        block.toolUse = true;
        block.input.append(fragment);
    }

    void finish(FinishReason reason) {
        if (state == State.IDLE || state == State.ACCUMULATING) {
            finishReason = reason;
            state = State.DONE;
        }
    }

    void recordUsage(LlmUsage usage) {
        this.usage = usage;
    }

    void fail() {
        blocks.clear();
        state = State.ERRORED;
    }

    /**
     * Drops partial content. A stream that already finished stays DONE.
     */
    void discard() {
        if (state != State.DONE) {
            fail();
        }
    }

    public boolean isDone() {
        return state == State.DONE;
    }

    /**
     * Assembles the accumulated assistant message. Tool arguments are kept as the
     * raw JSON text the backend sent.
     *
     * @throws IllegalStateException
     *             if the stream has not finished
     */
    public Message toMessage() {
        if (state != State.DONE) {
            throw new IllegalStateException("Stream not finished: " + state);
        }
        List<ContentBlock> contents = new ArrayList<>();
        for (PartialBlock block : blocks.values()) {
            if (block.toolUse) {
                String input = block.input.length() > 0 ? block.input.toString() : "{}";
                contents.add(ContentBlock.toolCall(block.toolUseId, block.name, input));
            } else if (block.text.length() > 0) {
                contents.add(ContentBlock.text(block.text.toString()));
            }
        }
        return Message.of(Role.ASSISTANT, contents);
    }

    private PartialBlock block(int index) {
        if (state == State.IDLE) {
            state = State.ACCUMULATING;
        }
        return blocks.computeIfAbsent(index, i -> new PartialBlock());
    }

    private static final class PartialBlock {
        private boolean toolUse;
        private String toolUseId;
        private String name;
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder input = new StringBuilder();
    }
}
