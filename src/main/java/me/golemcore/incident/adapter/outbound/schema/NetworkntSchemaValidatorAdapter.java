package me.golemcore.incident.adapter.outbound.schema;

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
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.port.outbound.SchemaValidatorPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON Schema validation backed by networknt json-schema-validator. Schemas
 * without a {@code $schema} keyword are read as draft 2020-12. Compiled schemas
 * are cached by their serialized text, so a caller changing a schema node after
 * use gets a fresh compilation.
 *
 * <p>
 * A schema that cannot be loaded or whose references cannot be resolved is
 * reported as a single violation instead of an exception.
 */
@Component
@Slf4j
public class NetworkntSchemaValidatorAdapter implements SchemaValidatorPort {

    private static final int MAX_CACHED_SCHEMAS = 256;

    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    @Override
    public List<String> validate(JsonNode instance, JsonNode schema) {
        Set<ValidationMessage> messages;
        try {
            // references are resolved lazily, so validation can fail on the schema too
            messages = compile(schema).validate(instance);
        } catch (JsonSchemaException e) {
            log.warn("[Schema] Cannot load schema: {}", e.getMessage());
            return List.of("Schema could not be loaded: " + e.getMessage());
        }

        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        return violations;
    }

    int cachedSchemaCount() {
        return compiled.size();
    }

    private JsonSchema compile(JsonNode schema) {
        String key = schema.toString();
        JsonSchema cached = compiled.get(key);
        if (cached != null) {
            return cached;
        }
        JsonSchema jsonSchema = schemaFactory.getSchema(schema.deepCopy());
        if (compiled.size() >= MAX_CACHED_SCHEMAS) {
            compiled.clear();
        }
        compiled.put(key, jsonSchema);
        return jsonSchema;
    }
}
