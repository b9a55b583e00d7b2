package me.golemcore.incident.domain.service;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.domain.model.LlmRequest;
import me.golemcore.incident.domain.model.StructuredOutput;
import me.golemcore.incident.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Chat that returns a JSON object conforming to a caller-supplied schema.
 *
 * <p>
 * Adds schema instructions to the request, calls the active LLM and runs the
 * answer through {@link StructuredOutputRecovery}. A recovery failure is
 * returned as a failed {@link StructuredOutput} so the caller can fall back to
 * the raw text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredChatService {

    private final LlmPort llmPort;
    private final StructuredOutputInstructions instructions;
    private final StructuredOutputRecovery recovery;

    public CompletableFuture<StructuredOutput> chat(LlmRequest request, JsonNode schema) {
        LlmRequest prepared = request.toBuilder()
                .messages(instructions.appendTo(request.getMessages(), schema))
                .build();

        return llmPort.chat(prepared).thenApply(response -> {
            StructuredOutput output = recovery.recover(response.getContent(), schema);
            if (!output.isSuccess()) {
                log.warn("[StructuredOutput] {} failure: {}", output.getFailureKind(), output.getError());
            }
            return output;
        });
    }
}
