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

import java.util.Locale;

/**
 * Sales funnel stage of a conversation. Stages only move forward.
 */
public enum ConversationStage {

    INITIAL, DISCOVERY, QUALIFYING, NEGOTIATING, CLOSED;

    /**
     * Returns the later of this stage and {@code suggested}.
     */
    public ConversationStage advanceTo(ConversationStage suggested) {
        if (suggested == null || suggested.ordinal() <= ordinal()) {
            return this;
        }
        return suggested;
    }

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a stage name; returns {@code null} for unknown input.
     */
    public static ConversationStage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
