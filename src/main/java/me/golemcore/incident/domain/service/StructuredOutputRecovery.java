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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.incident.domain.model.StructuredOutput;
import me.golemcore.incident.port.outbound.SchemaValidatorPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recovers a schema-conforming JSON object from free-form model text.
 *
 * <p>
 * Cleaning steps, applied in order:
 * <ol>
 * <li>trim;</li>
 * <li>drop everything up to the last reasoning close marker
 * ({@code </thinking>} or {@code </think>});</li>
 * <li>drop a leading {@code ---} front-matter block;</li>
 * <li>strip a surrounding code fence and its language tag;</li>
 * <li>restore a missing opening brace when the text starts with a quote;</li>
 * <li>append one closing brace when the object is cut short by a single
 * level.</li>
 * </ol>
 * The cleaned text is then parsed and validated. Failures are returned, never
 * thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredOutputRecovery {

    private static final String[] REASONING_CLOSE_MARKERS = { "</thinking>", "</think>" };
    private static final String FRONT_MATTER_DELIMITER = "---";
    private static final String FENCE = "```";
    private static final Pattern OPENING_FENCE = Pattern.compile("^```[\\w.+-]*");

    private final ObjectMapper objectMapper;
    private final SchemaValidatorPort schemaValidator;

    /**
     * Cleans, parses and validates {@code rawText}. The value must be a JSON
     * object. A {@code null} schema skips schema validation.
     */
    public StructuredOutput recover(String rawText, JsonNode schema) {
        String cleaned = clean(rawText);

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("[StructuredOutput] Parse failed: {}", e.getOriginalMessage());
            return StructuredOutput.failure(StructuredOutput.FailureKind.PARSE,
                    "Invalid JSON: " + e.getOriginalMessage(), rawText, cleaned);
        }
        if (parsed == null || parsed.isMissingNode()) {
            return StructuredOutput.failure(StructuredOutput.FailureKind.PARSE,
                    "Invalid JSON: no content", rawText, cleaned);
        }

        if (!parsed.isObject()) {
            return StructuredOutput.failure(StructuredOutput.FailureKind.VALIDATION,
                    "Expected a JSON object but got " + parsed.getNodeType(), rawText, cleaned);
        }

        if (schema != null) {
            List<String> violations;
            try {
                violations = schemaValidator.validate(parsed, schema);
            } catch (RuntimeException e) {
                log.warn("[StructuredOutput] Schema validator failed: {}", e.getMessage());
                return StructuredOutput.failure(StructuredOutput.FailureKind.VALIDATION,
                        "Schema validation could not run: " + e.getMessage(), rawText, cleaned);
            }
            if (!violations.isEmpty()) {
                log.debug("[StructuredOutput] Validation failed: {}", violations);
                return StructuredOutput.failure(StructuredOutput.FailureKind.VALIDATION,
                        "Schema validation failed: " + String.join("; ", violations), rawText, cleaned);
            }
        }

        try {
            return StructuredOutput.success(parsed, objectMapper.writeValueAsString(parsed), rawText, cleaned);
        } catch (JsonProcessingException e) {
            return StructuredOutput.failure(StructuredOutput.FailureKind.PARSE,
                    "Cannot serialize parsed value: " + e.getOriginalMessage(), rawText, cleaned);
        }
    }

    /**
     * Applies the cleaning steps without parsing.
     */
    public String clean(String rawText) {
        if (rawText == null) {
            return "";
        }
        String text = rawText.trim();
        text = stripReasoning(text);
        text = stripFrontMatter(text);
        text = stripCodeFence(text);

        if (text.startsWith("\"")) {
            text = "{" + text;
        }
        if (text.startsWith("{") && !text.endsWith("}") && count(text, '{') > count(text, '}')) {
            text = text + "}";
        }
        return text;
    }

    private static String stripReasoning(String text) {
        int cut = -1;
        for (String marker : REASONING_CLOSE_MARKERS) {
            int index = text.lastIndexOf(marker);
            if (index >= 0) {
                cut = Math.max(cut, index + marker.length());
            }
        }
        return cut >= 0 ? text.substring(cut).trim() : text;
    }

    private static String stripFrontMatter(String text) {
        if (!text.startsWith(FRONT_MATTER_DELIMITER)) {
            return text;
        }
        int end = text.indexOf(FRONT_MATTER_DELIMITER, FRONT_MATTER_DELIMITER.length());
        return end >= 0 ? text.substring(end + FRONT_MATTER_DELIMITER.length()).trim() : text;
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        String stripped = OPENING_FENCE.matcher(text).replaceFirst("").trim();
        if (stripped.endsWith(FENCE)) {
            stripped = stripped.substring(0, stripped.length() - FENCE.length()).trim();
        }
        return stripped;
    }

    private static long count(String text, char c) {
        return text.chars().filter(ch -> ch == c).count();
    }
}
