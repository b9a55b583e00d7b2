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
import me.golemcore.incident.domain.model.ContentBlock;
import me.golemcore.incident.domain.model.Message;
import me.golemcore.incident.domain.model.Role;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tells the model which JSON shape to answer with. The backend has no native
 * response-format option, so the schema travels as prompt text attached to the
 * last user turn.
 */
@Component
@RequiredArgsConstructor
public class StructuredOutputInstructions {

    private final ObjectMapper objectMapper;

    public String render(JsonNode schema) {
        String schemaText;
        try {
            schemaText = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            schemaText = String.valueOf(schema);
        }
        return "\n\nRespond with a single JSON object that conforms to this JSON schema:\n"
                + schemaText
                + "\nDo not wrap the JSON in markdown and do not add any text before or after it.";
    }

    /**
     * Returns a copy of {@code messages} carrying the schema instructions. They are
     * appended to the first text block of the last message when it is a user
     * turn; otherwise a new user message is added.
     */
    public List<Message> appendTo(List<Message> messages, JsonNode schema) {
        List<Message> result = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
        String instructions = render(schema);

        if (result.isEmpty() || !result.get(result.size() - 1).isUserMessage()) {
            result.add(Message.user(instructions.trim()));
            return result;
        }

        Message last = result.get(result.size() - 1);
        List<ContentBlock> contents = new ArrayList<>();
        boolean appended = false;
        for (ContentBlock block : last.getContents()) {
            if (!appended && block instanceof ContentBlock.Text text) {
                contents.add(ContentBlock.text(text.text() + instructions));
                appended = true;
            } else {
                contents.add(block);
            }
        }
        if (!appended) {
            contents.add(ContentBlock.text(instructions.trim()));
        }
        result.set(result.size() - 1, Message.of(Role.USER, contents));
        return result;
    }
}
