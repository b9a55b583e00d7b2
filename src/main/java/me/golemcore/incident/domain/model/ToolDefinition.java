package me.golemcore.incident.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Tool the model may call: name, human-readable description and a JSON Schema
 * object describing its input.
 */
@Value
@Builder(toBuilder = true)
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema; // JSON Schema

    /**
     * Schema used when a tool declares no parameters.
     */
    public static Map<String, Object> emptyObjectSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    /**
     * Creates a tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(emptyObjectSchema())
                .build();
    }
}
