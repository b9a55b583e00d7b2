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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of recovering a schema-conforming JSON object from model text.
 *
 * <p>
 * Failures are values, not exceptions: {@link #getFailureKind()} tells whether
 * the cleaned text was not JSON or did not match the schema, and
 * {@link #getCleanedText()} keeps what was actually parsed.
 */
@Value
@Builder(toBuilder = true)
public class StructuredOutput {

    private static final ObjectMapper CONVERTER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    boolean success;
    JsonNode value;
    String json;
    String rawText;
    String cleanedText;
    FailureKind failureKind;
    String error;

    public enum FailureKind {
        PARSE, VALIDATION
    }

    public static StructuredOutput success(JsonNode value, String json, String rawText, String cleanedText) {
        return StructuredOutput.builder()
                .success(true)
                .value(value)
                .json(json)
                .rawText(rawText)
                .cleanedText(cleanedText)
                .build();
    }

    public static StructuredOutput failure(FailureKind kind, String error, String rawText, String cleanedText) {
        return StructuredOutput.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .rawText(rawText)
                .cleanedText(cleanedText)
                .build();
    }

    /**
     * Binds the recovered object to {@code type}.
     *
     * @throws IllegalStateException
     *             if recovery failed or the object does not bind
     */
    public <T> T as(Class<T> type) {
        if (!success) {
            throw new IllegalStateException("No structured value available: " + error);
        }
        try {
            return CONVERTER.treeToValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot bind structured output to " + type.getSimpleName(), e);
        }
    }
}
