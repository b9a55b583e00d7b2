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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Body of a Converse / ConverseStream call. The model id travels in the URL
 * path, not in the body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConverseRequest {

    @JsonIgnore
    private String modelId;

    private List<ConverseMessage> messages;
    private List<SystemContent> system;
    private InferenceConfig inferenceConfig;
    private ToolConfig toolConfig;
    private Map<String, Object> additionalModelRequestFields;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemContent {
        private String text;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class InferenceConfig {
        private Integer maxTokens;
        private Double temperature;
        private Double topP;
        private List<String> stopSequences;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolConfig {
        private List<Tool> tools;
        private ToolChoice toolChoice;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tool {
        private ToolSpec toolSpec;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolSpec {
        private String name;
        private String description;
        private InputSchema inputSchema;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputSchema {
        private Map<String, Object> json;
    }

    /**
     * One of {@code {auto:{}}}, {@code {any:{}}}, {@code {none:{}}} or
     * {@code {tool:{name}}}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolChoice {
        private Map<String, Object> auto;
        private Map<String, Object> any;
        private Map<String, Object> none;
        private SpecificTool tool;

        public static ToolChoice auto() {
            return ToolChoice.builder().auto(Map.of()).build();
        }

        public static ToolChoice any() {
            return ToolChoice.builder().any(Map.of()).build();
        }

        public static ToolChoice none() {
            return ToolChoice.builder().none(Map.of()).build();
        }

        public static ToolChoice tool(String name) {
            return ToolChoice.builder().tool(new SpecificTool(name)).build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpecificTool {
        private String name;
    }
}
