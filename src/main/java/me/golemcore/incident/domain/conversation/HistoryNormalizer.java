package me.golemcore.incident.domain.conversation;

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

import me.golemcore.incident.domain.model.Message;

import java.util.List;

/**
 * Rewrites an arbitrary conversation history into one the backend accepts.
 *
 * <p>
 * Implementations never fail on malformed histories: they repair what they can
 * and drop the rest, reporting each change as a diagnostic. The input is never
 * mutated.
 */
public interface HistoryNormalizer {

    ConversationView normalize(List<Message> history);
}
