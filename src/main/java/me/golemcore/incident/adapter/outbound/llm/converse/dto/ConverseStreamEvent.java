package me.golemcore.incident.adapter.outbound.llm.converse.dto;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event of a ConverseStream response. Exactly one member is set per event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverseStreamEvent {

    private MessageStart messageStart;
    private ContentBlockStart contentBlockStart;
    private ContentBlockDelta contentBlockDelta;
    private ContentBlockStop contentBlockStop;
    private MessageStop messageStop;
    private Metadata metadata;

    public static ConverseStreamEvent textDelta(int index, String text) {
        Delta delta = new Delta(text, null);
        return ConverseStreamEvent.builder().contentBlockDelta(new ContentBlockDelta(index, delta)).build();
    }

    public static ConverseStreamEvent toolUseStart(int index, String toolUseId, String name) {
        Start start = new Start(new ToolUseStart(toolUseId, name));
        return ConverseStreamEvent.builder().contentBlockStart(new ContentBlockStart(index, start)).build();
    }

    public static ConverseStreamEvent toolUseDelta(int index, String input) {
        Delta delta = new Delta(null, new ToolUseDelta(input));
        return ConverseStreamEvent.builder().contentBlockDelta(new ContentBlockDelta(index, delta)).build();
    }

    public static ConverseStreamEvent blockStop(int index) {
        return ConverseStreamEvent.builder().contentBlockStop(new ContentBlockStop(index)).build();
    }

    public static ConverseStreamEvent messageStop(String stopReason) {
        return ConverseStreamEvent.builder().messageStop(new MessageStop(stopReason)).build();
    }

    public static ConverseStreamEvent metadata(ConverseResponse.TokenUsage usage) {
        return ConverseStreamEvent.builder().metadata(new Metadata(usage)).build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageStart {
        private String role;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockStart {
        private int contentBlockIndex;
        private Start start;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Start {
        private ToolUseStart toolUse;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolUseStart {
        private String toolUseId;
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockDelta {
        private int contentBlockIndex;
        private Delta delta;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {
        private String text;
        private ToolUseDelta toolUse;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolUseDelta {
        private String input;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockStop {
        private int contentBlockIndex;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageStop {
        private String stopReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private ConverseResponse.TokenUsage usage;
    }
}
