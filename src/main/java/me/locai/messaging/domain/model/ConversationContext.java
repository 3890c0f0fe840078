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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation state for one client of one tenant.
 *
 * <p>
 * Not thread-safe. The agent runtime only touches a context while holding the
 * lane lock for its key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContext {

    private String tenantId;
    private String clientKey;

    @Builder.Default
    private ConversationStage stage = ConversationStage.INITIAL;

    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, String> extractedInfo = new LinkedHashMap<>();

    private Instant lastMessageAt;
    private long tokensUsed;

    /** Created while the document store was unreadable; never written back. */
    @JsonIgnore
    private boolean detached;

    public static ConversationContext create(String tenantId, String clientKey) {
        return ConversationContext.builder()
                .tenantId(tenantId)
                .clientKey(clientKey)
                .build();
    }

    public void append(ConversationMessage message) {
        messages.add(message);
        lastMessageAt = message.getTimestamp();
    }

    public boolean containsMessageId(String messageId) {
        if (messageId == null) {
            return false;
        }
        for (ConversationMessage message : messages) {
            if (messageId.equals(message.getId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * The last {@code window} messages, oldest first.
     */
    @JsonIgnore
    public List<ConversationMessage> recent(int window) {
        int from = Math.max(0, messages.size() - Math.max(window, 0));
        return List.copyOf(messages.subList(from, messages.size()));
    }

    public void mergeExtractedInfo(Map<String, String> info) {
        if (info == null) {
            return;
        }
        info.forEach((slot, value) -> {
            if (slot != null && value != null && !value.isBlank()) {
                extractedInfo.put(slot, value);
            }
        });
    }

    public void advanceStage(ConversationStage suggested) {
        stage = stage.advanceTo(suggested);
    }

    public void addTokens(long tokens) {
        tokensUsed += Math.max(tokens, 0);
    }
}
