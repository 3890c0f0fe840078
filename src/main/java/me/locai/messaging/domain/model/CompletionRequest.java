package me.locai.messaging.domain.model;

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

import java.util.List;
import java.util.Map;

/**
 * Input for intent classification and function selection.
 *
 * @param history
 *            recent conversation messages, oldest first, including the current
 *            one
 * @param availableFunctions
 *            names of the business functions the model may select
 */
public record CompletionRequest(String tenantId, String text, List<ConversationMessage> history,
        ConversationStage stage, Map<String, String> knownInfo, List<String> availableFunctions) {
}
