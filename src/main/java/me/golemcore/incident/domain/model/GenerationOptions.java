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

import java.util.List;

/**
 * Sampling settings for one request. Unset values are left to the backend.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {

    String modelId;
    Double temperature;
    Integer maxTokens;
    Double topP;
    Integer topK;
    List<String> stopSequences;

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
}
