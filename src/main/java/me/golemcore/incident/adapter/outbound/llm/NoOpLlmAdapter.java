package me.golemcore.incident.adapter.outbound.llm;

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
import me.golemcore.incident.domain.model.FinishReason;
import me.golemcore.incident.domain.model.LlmChunk;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.domain.model.LlmUsage;
import me.golemcore.incident.domain.model.Message;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no backend is configured. Returns a placeholder
 * answer without any network call.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .message(Message.assistant(PLACEHOLDER))
                .content(PLACEHOLDER)
                .model("none")
                .finishReason(FinishReason.STOP)
                .usage(LlmUsage.of(0, 0))
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.just(LlmChunk.text(PLACEHOLDER), LlmChunk.finish(FinishReason.STOP, LlmUsage.of(0, 0)));
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of();
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
