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

import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;
import dev.langchain4j.model.chat.request.json.JsonAnyOfSchema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonReferenceSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Produces {@link ToolDefinition}s for the backend from either declared
 * definitions or methods annotated with {@link Tool}.
 *
 * <p>
 * Annotated methods are described by langchain4j's {@link ToolSpecifications}
 * and the resulting parameter schema is rendered as a JSON Schema map.
 * Parameter names come from the class file, so tool classes must be compiled
 * with {@code -parameters}.
 *
 * <p>
 * Building a batch never fails as a whole: a tool that cannot be described is
 * left out and reported in {@link ToolSchemaResult#dropped()}.
 */
@Component
@Slf4j
public class ToolSchemaBuilder {

    private static final String SCHEMA_KEY_TYPE = "type";

    /**
     * Tools that made it into the batch plus the ones that were excluded.
     */
    public record ToolSchemaResult(List<ToolDefinition> tools, List<DroppedTool> dropped) {

        public ToolSchemaResult {
            tools = List.copyOf(tools);
            dropped = List.copyOf(dropped);
        }

        public boolean hasDropped() {
            return !dropped.isEmpty();
        }
    }

    public record DroppedTool(String name, String reason) {
    }

    /**
     * Builds definitions for a mixed batch of descriptors. Accepted kinds are
     * {@link ToolDefinition}, {@link Method}, and any object exposing
     * {@link Tool}-annotated methods.
     */
    public ToolSchemaResult buildAll(Collection<?> descriptors) {
        List<ToolDefinition> tools = new ArrayList<>();
        List<DroppedTool> dropped = new ArrayList<>();
        if (descriptors == null) {
            return new ToolSchemaResult(tools, dropped);
        }

        for (Object descriptor : descriptors) {
            if (descriptor instanceof ToolDefinition definition) {
                collect(() -> fromDefinition(definition), String.valueOf(definition.getName()), tools, dropped);
            } else if (descriptor instanceof Method method) {
                collect(() -> fromMethod(method), method.getName(), tools, dropped);
            } else if (descriptor != null) {
                List<Method> toolMethods = findToolMethods(descriptor.getClass());
                if (toolMethods.isEmpty()) {
                    dropped.add(new DroppedTool(descriptor.getClass().getSimpleName(),
                            "no @Tool methods found"));
                    continue;
                }
                for (Method method : toolMethods) {
                    collect(() -> fromMethod(method), method.getName(), tools, dropped);
                }
            }
        }

        for (DroppedTool tool : dropped) {
            log.warn("[Tools] Excluding tool '{}': {}", tool.name(), tool.reason());
        }
        return new ToolSchemaResult(tools, dropped);
    }

    /**
     * Validates a declared definition and fills in defaults.
     *
     * @throws IllegalArgumentException
     *             if the definition has no name
     */
    public ToolDefinition fromDefinition(ToolDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new IllegalArgumentException("tool name is missing");
        }
        String description = definition.getDescription() != null && !definition.getDescription().isBlank()
                ? definition.getDescription()
                : "Tool: " + definition.getName();
        Map<String, Object> schema = definition.getInputSchema() != null
                ? definition.getInputSchema()
                : ToolDefinition.emptyObjectSchema();
        return definition.toBuilder().description(description).inputSchema(schema).build();
    }

    /**
     * Introspects a {@link Tool}-annotated method.
     *
     * @throws IllegalArgumentException
     *             if the method is not a tool, its parameter names were not
     *             retained at compile time or its schema cannot be rendered
     */
    public ToolDefinition fromMethod(Method method) {
        if (!method.isAnnotationPresent(Tool.class)) {
            throw new IllegalArgumentException("method is not annotated with @Tool");
        }
        for (Parameter parameter : method.getParameters()) {
            if (!parameter.isNamePresent()) {
                throw new IllegalArgumentException("parameter names are not available, compile with -parameters");
            }
        }

        ToolSpecification specification = ToolSpecifications.toolSpecificationFrom(method);
        String description = specification.description() != null && !specification.description().isBlank()
                ? specification.description()
                : "Tool: " + specification.name();
        Map<String, Object> schema = specification.parameters() != null
                ? toSchemaMap(specification.parameters())
                : ToolDefinition.emptyObjectSchema();

        return ToolDefinition.builder()
                .name(specification.name())
                .description(description)
                .inputSchema(schema)
                .build();
    }

    /**
     * Renders a langchain4j schema element as a JSON Schema map.
     *
     * @throws IllegalArgumentException
     *             for element kinds the backend schema cannot express
     */
    static Map<String, Object> toSchemaMap(JsonSchemaElement element) {
        Map<String, Object> schema = new LinkedHashMap<>();
        if (element instanceof JsonObjectSchema object) {
            schema.put(SCHEMA_KEY_TYPE, "object");
            putDescription(schema, object.description());
            Map<String, Object> properties = new LinkedHashMap<>();
            if (object.properties() != null) {
                object.properties().forEach((name, property) -> properties.put(name, toSchemaMap(property)));
            }
            schema.put("properties", properties);
            if (object.required() != null && !object.required().isEmpty()) {
                schema.put("required", List.copyOf(object.required()));
            }
            if (object.additionalProperties() != null) {
                schema.put("additionalProperties", object.additionalProperties());
            }
            if (object.definitions() != null && !object.definitions().isEmpty()) {
                Map<String, Object> definitions = new LinkedHashMap<>();
                object.definitions().forEach((name, definition) -> definitions.put(name, toSchemaMap(definition)));
                schema.put("$defs", definitions);
            }
        } else if (element instanceof JsonEnumSchema enumSchema) {
            schema.put(SCHEMA_KEY_TYPE, "string");
            putDescription(schema, enumSchema.description());
            schema.put("enum", List.copyOf(enumSchema.enumValues()));
        } else if (element instanceof JsonStringSchema string) {
            schema.put(SCHEMA_KEY_TYPE, "string");
            putDescription(schema, string.description());
        } else if (element instanceof JsonIntegerSchema integer) {
            schema.put(SCHEMA_KEY_TYPE, "integer");
            putDescription(schema, integer.description());
        } else if (element instanceof JsonNumberSchema number) {
            schema.put(SCHEMA_KEY_TYPE, "number");
            putDescription(schema, number.description());
        } else if (element instanceof JsonBooleanSchema bool) {
            schema.put(SCHEMA_KEY_TYPE, "boolean");
            putDescription(schema, bool.description());
        } else if (element instanceof JsonArraySchema array) {
            schema.put(SCHEMA_KEY_TYPE, "array");
            putDescription(schema, array.description());
            if (array.items() != null) {
                schema.put("items", toSchemaMap(array.items()));
            }
        } else if (element instanceof JsonAnyOfSchema anyOf) {
            putDescription(schema, anyOf.description());
            List<Object> alternatives = new ArrayList<>();
            for (JsonSchemaElement alternative : anyOf.anyOf()) {
                alternatives.add(toSchemaMap(alternative));
            }
            schema.put("anyOf", alternatives);
        } else if (element instanceof JsonReferenceSchema reference) {
            schema.put("$ref", "#/$defs/" + reference.reference());
        } else {
            throw new IllegalArgumentException("unsupported parameter schema: "
                    + (element != null ? element.getClass().getSimpleName() : "null"));
        }
        return schema;
    }

    private static void putDescription(Map<String, Object> schema, String description) {
        if (description != null && !description.isBlank()) {
            schema.put("description", description);
        }
    }

    private List<Method> findToolMethods(Class<?> type) {
        List<Method> methods = new ArrayList<>();
        for (Method method : type.getMethods()) {
            if (method.isAnnotationPresent(Tool.class)) {
                methods.add(method);
            }
        }
        methods.sort((a, b) -> a.getName().compareTo(b.getName()));
        return methods;
    }

    private void collect(Supplier<ToolDefinition> factory, String name, List<ToolDefinition> tools,
            List<DroppedTool> dropped) {
        try {
            tools.add(factory.get());
        } catch (RuntimeException e) {
            dropped.add(new DroppedTool(name, e.getMessage()));
        }
    }
}
