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

import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.CompletionRequest;
import me.locai.messaging.domain.model.CompletionResult;
import me.locai.messaging.domain.model.ConversationStage;
import me.locai.messaging.domain.model.FunctionCall;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline classifier that maps client messages to intents by keyword.
 *
 * <p>
 * Understands English and Portuguese phrasing for the main rental intents
 * (search, pricing, availability, reservation) and extracts the guest count,
 * bedroom count and city when present. Used when no AI provider is
 * configured, and as a predictable provider in tests.
 */
@Component
@Slf4j
public class KeywordCompletionAdapter implements CompletionProviderAdapter {

    static final String PROVIDER_ID = "keyword";

    static final String INTENT_GREETING = "greeting";
    static final String INTENT_SEARCH = "search_properties";
    static final String INTENT_PRICE = "price_inquiry";
    static final String INTENT_AVAILABILITY = "availability_inquiry";
    static final String INTENT_RESERVATION = "reservation";
    static final String INTENT_GENERAL = "general";

    private static final List<String> RESERVATION_WORDS = List.of(
            "reserve", "reservar", "reserva", "book", "booking", "fechar", "confirmar");
    private static final List<String> AVAILABILITY_WORDS = List.of(
            "available", "availability", "disponivel", "disponibilidade", "free on", "livre");
    private static final List<String> PRICE_WORDS = List.of(
            "price", "cost", "how much", "quanto", "preco", "valor", "diaria", "rate");
    private static final List<String> SEARCH_WORDS = List.of(
            "rent", "apartment", "house", "property", "properties", "flat", "place to stay", "looking for",
            "alugar", "aluguel", "apartamento", "casa", "imovel", "imoveis", "procuro", "procurando");
    private static final List<String> GREETING_WORDS = List.of(
            "hello", "hi", "hey", "good morning", "good afternoon", "ola", "oi", "bom dia", "boa tarde",
            "boa noite");

    private static final Pattern GUESTS = Pattern.compile(
            "(\\d{1,2})\\s*(people|persons|guests|adults|pessoas|hospedes|adultos)");
    private static final Pattern BEDROOMS = Pattern.compile(
            "(\\d{1,2})\\s*(bedrooms?|rooms?|quartos?)");
    private static final Pattern CITY = Pattern.compile(
            "\\b(?:in|em|no|na)\\s+([a-z][a-z ]{2,30}?)(?=[,.!?]|\\s+for\\b|\\s+para\\b|\\s+with\\b|\\s+com\\b|$)");

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<CompletionResult> classifyAndDispatch(CompletionRequest request) {
        return CompletableFuture.completedFuture(classify(request));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    CompletionResult classify(CompletionRequest request) {
        String text = normalize(request.text());
        Map<String, String> extracted = extract(text);
        List<FunctionCall> calls = new ArrayList<>();
        String intent;
        ConversationStage stage;
        String draft;

        Map<String, Object> searchArgs = new LinkedHashMap<>(merged(request.knownInfo(), extracted));

        if (containsAny(text, RESERVATION_WORDS)) {
            intent = INTENT_RESERVATION;
            stage = ConversationStage.NEGOTIATING;
            addIfAvailable(calls, request, "create_reservation", searchArgs);
            draft = "Great, let's get your reservation started.";
        } else if (containsAny(text, AVAILABILITY_WORDS)) {
            intent = INTENT_AVAILABILITY;
            stage = ConversationStage.QUALIFYING;
            addIfAvailable(calls, request, "check_availability", searchArgs);
            draft = "Let me check the availability for you.";
        } else if (containsAny(text, PRICE_WORDS)) {
            intent = INTENT_PRICE;
            stage = ConversationStage.QUALIFYING;
            addIfAvailable(calls, request, "calculate_total_price", searchArgs);
            draft = "Let me calculate the price for you.";
        } else if (containsAny(text, SEARCH_WORDS)) {
            intent = INTENT_SEARCH;
            stage = ConversationStage.DISCOVERY;
            addIfAvailable(calls, request, "search_properties", searchArgs);
            draft = "Sure! Let me look for properties that match what you need.";
        } else if (containsAny(text, GREETING_WORDS)) {
            intent = INTENT_GREETING;
            stage = ConversationStage.INITIAL;
            draft = "Hello! How can I help you find a place to stay?";
        } else {
            intent = INTENT_GENERAL;
            stage = null;
            draft = "Could you tell me a bit more about what you are looking for?";
        }

        log.debug("[Keyword] Classified message as {} with {} function(s)", intent, calls.size());
        return CompletionResult.builder()
                .intent(intent)
                .functionCalls(calls)
                .extractedInfo(extracted)
                .replyDraft(draft)
                .suggestedStage(stage)
                .tokensUsed(0)
                .build();
    }

    private static Map<String, String> extract(String text) {
        Map<String, String> info = new LinkedHashMap<>();
        Matcher guests = GUESTS.matcher(text);
        if (guests.find()) {
            info.put("guests", guests.group(1));
        }
        Matcher bedrooms = BEDROOMS.matcher(text);
        if (bedrooms.find()) {
            info.put("bedrooms", bedrooms.group(1));
        }
        Matcher city = CITY.matcher(text);
        if (city.find()) {
            info.put("city", city.group(1).trim());
        }
        return info;
    }

    private static Map<String, Object> merged(Map<String, String> known, Map<String, String> extracted) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (known != null) {
            args.putAll(known);
        }
        args.putAll(extracted);
        return args;
    }

    private static void addIfAvailable(List<FunctionCall> calls, CompletionRequest request, String name,
            Map<String, Object> args) {
        List<String> available = request.availableFunctions();
        if (available == null || available.contains(name)) {
            calls.add(new FunctionCall(name, args));
        }
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String word : words) {
            if (word.contains(" ") ? text.contains(word) : containsWord(text, word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT).trim();
    }
}
