package me.locai.messaging.domain.service;

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

import me.locai.messaging.domain.model.ConversationStage;
import me.locai.messaging.domain.model.FunctionResult;

import java.util.List;
import java.util.Map;

/**
 * Derives the next conversation stage from the completion's suggestion and
 * the functions that ran successfully. The result never moves backwards.
 */
public final class ConversationStageResolver {

    private static final Map<String, ConversationStage> STAGE_BY_FUNCTION = Map.of(
            "search_properties", ConversationStage.DISCOVERY,
            "get_property_details", ConversationStage.DISCOVERY,
            "check_availability", ConversationStage.QUALIFYING,
            "calculate_total_price", ConversationStage.QUALIFYING,
            "register_client", ConversationStage.QUALIFYING,
            "schedule_visit", ConversationStage.NEGOTIATING,
            "apply_discount", ConversationStage.NEGOTIATING,
            "create_reservation", ConversationStage.CLOSED);

    private ConversationStageResolver() {
    }

    public static ConversationStage resolve(ConversationStage current, ConversationStage suggested,
            List<FunctionResult> results) {
        ConversationStage next = current.advanceTo(suggested);
        for (FunctionResult result : results) {
            if (result.success()) {
                next = next.advanceTo(STAGE_BY_FUNCTION.get(result.name()));
            }
        }
        return next;
    }
}
