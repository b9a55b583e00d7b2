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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseStreamEvent;
import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmChunk;
import me.golemcore.incident.domain.model.LlmUsage;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;

/**
 * Turns a ConverseStream event sequence into {@link LlmChunk} updates.
 *
 * <p>
 * Text deltas are emitted as they arrive. Tool input fragments are accumulated
 * silently. A message stop produces one final chunk carrying the finish reason
 * and whatever usage is known at that point. The usage {@code metadata} event
 * that follows a message stop is the last event of a response, so the decoded
 * stream completes on it. Without that event the stream completes with the
 * upstream. Transport errors propagate unchanged; cancellation discards partial
 * state without a final chunk.
 */
@Component
@Slf4j
public class ConverseStreamDecoder {

    /**
     * Decodes with a fresh accumulator per subscription.
     */
    public Flux<LlmChunk> decode(Flux<ConverseStreamEvent> events) {
        return Flux.defer(() -> decode(events, new StreamAccumulator()));
    }

    /**
     * Decodes into a caller-owned accumulator, which can be inspected once the
     * stream completes.
     */
    public Flux<LlmChunk> decode(Flux<ConverseStreamEvent> events, StreamAccumulator accumulator) {
        return events
                .<LlmChunk>handle((event, sink) -> onEvent(event, accumulator, sink))
                .doOnError(e -> {
                    log.debug("[Converse] Stream failed in state {}: {}", accumulator.getState(), e.getMessage());
                    accumulator.fail();
                })
                .doOnCancel(accumulator::discard);
    }

    private void onEvent(ConverseStreamEvent event, StreamAccumulator accumulator, SynchronousSink<LlmChunk> sink) {
        if (event.getMetadata() != null) {
            onMetadata(event.getMetadata(), accumulator);
            if (accumulator.getState() == StreamAccumulator.State.DONE) {
                sink.complete();
            }
            return;
        }
        if (accumulator.getState() == StreamAccumulator.State.DONE) {
            log.debug("[Converse] Ignoring event after message stop");
            return;
        }

        if (event.getContentBlockStart() != null) {
            ConverseStreamEvent.ContentBlockStart start = event.getContentBlockStart();
            ConverseStreamEvent.ToolUseStart toolUse = start.getStart() != null ? start.getStart().getToolUse() : null;
            if (toolUse != null) {
                accumulator.startToolUse(start.getContentBlockIndex(), toolUse.getToolUseId(), toolUse.getName());
            } else {
                accumulator.startText(start.getContentBlockIndex());
            }
        } else if (event.getContentBlockDelta() != null) {
            ConverseStreamEvent.ContentBlockDelta blockDelta = event.getContentBlockDelta();
            ConverseStreamEvent.Delta delta = blockDelta.getDelta();
            if (delta == null) {
                return;
            }
            if (delta.getText() != null) {
                accumulator.appendText(blockDelta.getContentBlockIndex(), delta.getText());
                if (!delta.getText().isEmpty()) {
                    sink.next(LlmChunk.text(delta.getText()));
                }
            } else if (delta.getToolUse() != null && delta.getToolUse().getInput() != null) {
                accumulator.appendToolInput(blockDelta.getContentBlockIndex(), delta.getToolUse().getInput());
            }
        } else if (event.getMessageStop() != null) {
            FinishReason reason = StopReasons.toFinishReason(event.getMessageStop().getStopReason());
            accumulator.finish(reason);
            sink.next(LlmChunk.finish(reason, accumulator.getUsage()));
        }
    }

    private void onMetadata(ConverseStreamEvent.Metadata metadata, StreamAccumulator accumulator) {
        ConverseResponse.TokenUsage usage = metadata.getUsage();
        if (usage == null) {
            return;
        }
        int input = usage.getInputTokens() != null ? usage.getInputTokens() : 0;
        int output = usage.getOutputTokens() != null ? usage.getOutputTokens() : 0;
        int total = usage.getTotalTokens() != null ? usage.getTotalTokens() : input + output;
        accumulator.recordUsage(LlmUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(total)
                .build());
        log.debug("[Converse] Stream usage: {} in, {} out", input, output);
    }
}
