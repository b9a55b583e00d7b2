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

import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseRequest;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseResponse;
import me.golemcore.incident.adapter.outbound.llm.converse.dto.ConverseStreamEvent;
import reactor.core.publisher.Flux;

/**
 * Wire-level access to a Converse-style backend. Backend failures surface as
 * {@code ConverseApiException}; nothing is retried here.
 */
public interface ConverseTransport {

    /**
     * Sends a request and blocks until the full response arrives.
     */
    ConverseResponse converse(ConverseRequest request);

    /**
     * Sends a request and emits the backend's stream events in arrival order.
     * Cancelling the subscription aborts the underlying call.
     */
    Flux<ConverseStreamEvent> converseStream(ConverseRequest request);
}
