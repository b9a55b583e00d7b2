package me.golemcore.incident;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the incident analysis agent's LLM layer.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout:
 *
 * <pre>
 * Domain          → model, conversation normalization, tool schemas, structured output
 * Ports           → LlmPort, SchemaValidatorPort
 * Adapters        → Converse backend (OkHttp), networknt schema validation
 * Infrastructure  → configuration properties, HTTP client
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IncidentApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentApplication.class, args);
    }
}
