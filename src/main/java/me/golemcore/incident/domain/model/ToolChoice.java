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

import java.util.Locale;
import java.util.Map;

/**
 * How the model may use the offered tools.
 *
 * <p>
 * {@link #from(Object)} is lenient: anything it does not recognise becomes
 * {@link #AUTO}.
 */
public record ToolChoice(Mode mode, String toolName) {

    public enum Mode {
        AUTO, ANY, NONE, TOOL
    }

    public static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);
    public static final ToolChoice ANY = new ToolChoice(Mode.ANY, null);
    public static final ToolChoice NONE = new ToolChoice(Mode.NONE, null);

    public ToolChoice {
        if (mode == null) {
            mode = Mode.AUTO;
        }
        if (mode != Mode.TOOL) {
            toolName = null;
        }
    }

    public static ToolChoice tool(String name) {
        if (name == null || name.isBlank()) {
            return AUTO;
        }
        return new ToolChoice(Mode.TOOL, name);
    }

    /**
     * Accepts a {@code ToolChoice}, one of the strings {@code auto}, {@code any},
     * {@code none}, or a map carrying a {@code name} entry.
     */
    public static ToolChoice from(Object raw) {
        if (raw instanceof ToolChoice choice) {
            return choice;
        }
        if (raw instanceof String value) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "any":
                return ANY;
            case "none":
                return NONE;
            default:
                return AUTO;
            }
        }
        if (raw instanceof Map<?, ?> map && map.get("name") instanceof String name) {
            return tool(name);
        }
        return AUTO;
    }
}
