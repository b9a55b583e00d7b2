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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.adapter.outbound.llm.LlmProviderAdapter;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.LlmChunk;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.LlmResponse;
import me.golemcore.incident.infrastructure.config.IncidentProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for Converse-protocol backends.
 *
 * <p>
 * Requests are encoded by {@link ConverseRequestEncoder}, sent through
 * {@link ConverseTransport}, and decoded by {@link ConverseResponseParser} or
 * {@link ConverseStreamDecoder}. Backend errors propagate unchanged.
 *
 * <p>
 * Streaming requests that offer tools are served by a single-shot call whose
 * response is replayed as chunks: text first, then one chunk per tool call,
 * then the finish chunk.
 *
 * <p>
 * Provider ID: {@code "converse"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConverseLlmAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_ID = "converse";

    private final IncidentProperties properties;
    private final ConverseRequestEncoder encoder;
    private final ConverseResponseParser responseParser;
    private final ConverseStreamDecoder streamDecoder;
    private final ConverseTransport transport;

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> execute(encoder.encode(request, getCurrentModel())));
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.defer(() -> {
            ConverseRequest converseRequest = encoder.encode(request, getCurrentModel());
            if (converseRequest.getToolConfig() != null) {
                log.debug("[Converse] Tools present, streaming via single-shot call");
                return Mono.fromCallable(() -> execute(converseRequest))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMapIterable(ConverseLlmAdapter::toChunks);
            }
            return streamDecoder.decode(transport.converseStream(converseRequest));
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public List<String> getSupportedModels() {
        String model = getCurrentModel();
        return model != null ? List.of(model) : List.of();
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getConverse().getModelId();
    }

    @Override
    public boolean isAvailable() {
        IncidentProperties.ConverseProperties config = properties.getLlm().getConverse();
        return isSet(config.getEndpoint()) && isSet(config.getModelId());
    }

    private LlmResponse execute(ConverseRequest converseRequest) {
        log.debug("[Converse] Sending {} message(s) to {}",
                converseRequest.getMessages().size(), converseRequest.getModelId());
        LlmResponse response = responseParser.parse(transport.converse(converseRequest),
                converseRequest.getModelId());
        log.debug("[Converse] Finished with {} ({} tool call(s))",
                response.getFinishReason(), response.getToolCalls().size());
        return response;
    }

    static List<LlmChunk> toChunks(LlmResponse response) {
        List<LlmChunk> chunks = new ArrayList<>();
        for (ContentBlock block : response.getMessage().getContents()) {
            if (block instanceof ContentBlock.Text text && !text.text().isEmpty()) {
                chunks.add(LlmChunk.text(text.text()));
            }
        }
        for (ContentBlock.ToolCall call : response.getToolCalls()) {
            chunks.add(LlmChunk.toolCall(call));
        }
        chunks.add(LlmChunk.finish(response.getFinishReason(), response.getUsage()));
        return chunks;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
