package me.locai.messaging.adapter.outbound.completion;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.CompletionRequest;
import me.locai.messaging.domain.model.CompletionResult;
import me.locai.messaging.domain.model.ConversationMessage;
import me.locai.messaging.domain.model.ConversationStage;
import me.locai.messaging.domain.model.FunctionCall;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Completion adapter backed by an OpenAI-compatible chat model through
 * langchain4j.
 *
 * <p>
 * The model is asked to answer with a single JSON object:
 *
 * <pre>
 * {"intent": "...", "functions": [{"name": "...", "arguments": {...}}],
 *  "extractedInfo": {"slot": "value"}, "reply": "...", "stage": "discovery"}
 * </pre>
 *
 * Function names outside the offered list are dropped. Retries are disabled;
 * the agent runtime owns the time budget.
 */
@Component
@Slf4j
public class Langchain4jCompletionAdapter implements CompletionProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private static final String SYSTEM_PROMPT = """
            You are the booking assistant of a vacation rental company, talking to a client over chat.
            Classify the client's last message, decide which business functions to call and draft a short,
            friendly reply in the client's language.
            Available functions: %s.
            Current conversation stage: %s. Known client details: %s.
            Answer with one JSON object and nothing else, using the keys
            "intent" (string), "functions" (array of {"name", "arguments"}), "extractedInfo" (object of strings),
            "reply" (string) and "stage" (one of initial, discovery, qualifying, negotiating, closed).
            """;

    private final ObjectMapper objectMapper;
    private final ChatModel chatModel;

    @Autowired
    public Langchain4jCompletionAdapter(MessagingProperties properties, ObjectMapper objectMapper) {
        this(objectMapper, buildModel(properties.getAi()));
    }

    Langchain4jCompletionAdapter(ObjectMapper objectMapper, ChatModel chatModel) {
        this.objectMapper = objectMapper;
        this.chatModel = chatModel;
    }

    private static ChatModel buildModel(MessagingProperties.AiProperties ai) {
        if (ai.getApiKey() == null || ai.getApiKey().isBlank()) {
            return null;
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(ai.getApiKey())
                .modelName(ai.getModel())
                .maxRetries(0)
                .temperature(ai.getTemperature())
                .timeout(ai.getTimeout());
        if (ai.getBaseUrl() != null && !ai.getBaseUrl().isBlank()) {
            builder.baseUrl(ai.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public CompletableFuture<CompletionResult> classifyAndDispatch(CompletionRequest request) {
        if (chatModel == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("langchain4j model not configured"));
        }
        return CompletableFuture.supplyAsync(() -> {
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .build();
            ChatResponse response = chatModel.chat(chatRequest);
            return convertResponse(response, request.availableFunctions());
        });
    }

    private List<ChatMessage> convertMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        ConversationStage stage = request.stage() != null ? request.stage() : ConversationStage.INITIAL;
        messages.add(SystemMessage.from(String.format(SYSTEM_PROMPT,
                request.availableFunctions() != null ? String.join(", ", request.availableFunctions()) : "none",
                stage.getWireName(),
                request.knownInfo() != null ? request.knownInfo() : Map.of())));

        List<ConversationMessage> history = request.history() != null ? request.history() : List.of();
        for (ConversationMessage message : history) {
            if (message.getContent() == null || message.getContent().isBlank()) {
                continue;
            }
            if (message.isUserMessage()) {
                messages.add(UserMessage.from(message.getContent()));
            } else {
                messages.add(AiMessage.from(message.getContent()));
            }
        }
        boolean lastIsCurrent = !history.isEmpty()
                && history.get(history.size() - 1).isUserMessage()
                && request.text().equals(history.get(history.size() - 1).getContent());
        if (!lastIsCurrent) {
            messages.add(UserMessage.from(request.text()));
        }
        return messages;
    }

    CompletionResult convertResponse(ChatResponse response, List<String> availableFunctions) {
        AiMessage aiMessage = response.aiMessage();
        String raw = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        long tokens = 0;
        if (response.tokenUsage() != null && response.tokenUsage().totalTokenCount() != null) {
            tokens = response.tokenUsage().totalTokenCount();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Completion response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Completion response is not a JSON object");
        }

        List<FunctionCall> calls = new ArrayList<>();
        for (JsonNode function : root.path("functions")) {
            String name = function.path("name").asText("");
            if (name.isBlank() || (availableFunctions != null && !availableFunctions.contains(name))) {
                log.debug("[LLM] Ignoring unknown function '{}'", name);
                continue;
            }
            Map<String, Object> args = function.has("arguments") && function.get("arguments").isObject()
                    ? objectMapper.convertValue(function.get("arguments"), MAP_TYPE_REF)
                    : Map.of();
            calls.add(new FunctionCall(name, args));
        }

        Map<String, String> extracted = new LinkedHashMap<>();
        root.path("extractedInfo").fields().forEachRemaining(entry -> {
            if (!entry.getValue().isNull()) {
                extracted.put(entry.getKey(), entry.getValue().asText());
            }
        });

        return CompletionResult.builder()
                .intent(root.path("intent").asText("general"))
                .functionCalls(calls)
                .extractedInfo(extracted)
                .replyDraft(root.path("reply").asText(""))
                .suggestedStage(ConversationStage.parse(root.path("stage").asText(null)))
                .tokensUsed(tokens)
                .build();
    }

    private static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
