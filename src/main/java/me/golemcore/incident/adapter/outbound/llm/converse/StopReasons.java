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

import me.golemcore.incident.domain.model.FinishReason;

/**
 * Maps Converse stop reasons to {@link FinishReason}. Unknown or missing reasons
 * map to {@link FinishReason#STOP}.
 */
final class StopReasons {

    private StopReasons() {
    }

    static FinishReason toFinishReason(String stopReason) {
        if (stopReason == null) {
            return FinishReason.STOP;
        }
        switch (stopReason) {
        case "max_tokens":
            return FinishReason.LENGTH;
        case "tool_use":
            return FinishReason.TOOL_CALLS;
        case "content_filtered":
        case "guardrail_intervened":
            return FinishReason.CONTENT_FILTER;
        default:
            return FinishReason.STOP;
        }
    }
}
