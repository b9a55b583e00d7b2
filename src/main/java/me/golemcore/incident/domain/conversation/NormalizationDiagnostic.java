package me.golemcore.incident.domain.conversation;

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
 * Record of one change the normalizer made to the history.
 *
 * @param kind
 *            what happened
 * @param messageIndex
 *            index of the affected message in the input history
 * @param callId
 *            correlation id involved, or {@code null}
 * @param detail
 *            free-form description
 */
public record NormalizationDiagnostic(Kind kind, int messageIndex, String callId, String detail) {

    public enum Kind {
        /** Call and result for the same id inside one tool message. */
        INTERNAL_TOOL_PAIR,
        /** Tool message with both calls and results split into user content. */
        MIXED_CONTENT_SPLIT,
        TOOL_CALL_CONVERTED,
        TOOL_RESULT_CONVERTED,
        TOOL_CALL_DROPPED,
        TOOL_RESULT_DROPPED,
        ORPHANED_TOOL_RESULT,
        EMPTY_MESSAGE_DROPPED,
        SYSTEM_EXTRACTED
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase()).append("@").append(messageIndex);
        if (callId != null) {
            sb.append(" [").append(callId).append("]");
        }
        if (detail != null) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
