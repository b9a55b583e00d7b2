package me.golemcore.incident.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties bound from application.properties under the
 * {@code incident.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - provider selection and the Converse backend</li>
 * <li>{@link HttpProperties} - shared HTTP client timeouts and pooling</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "incident")
@Data
public class IncidentProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LlmProperties {
        private String provider = "converse";
        private ConverseProperties converse = new ConverseProperties();
    }

    @Data
    public static class ConverseProperties {
        private String endpoint;
        private String apiKey;
        private String modelId;
        /**
         * Floor for the output token limit. Requests asking for less, or for
         * nothing, are raised to this value.
         */
        private int minMaxTokens = 8192;
        private String conversePath = "/model/{modelId}/converse";
        private String streamPath = "/model/{modelId}/converse-stream";
        private long requestTimeout = 300000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
