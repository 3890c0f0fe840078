package me.locai.messaging.adapter.outbound.function;

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
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.FunctionResult;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.BusinessFunctionPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Calls the platform's business function endpoints over HTTP.
 *
 * <p>
 * A function {@code search_properties} is served at
 * {@code POST {baseUrl}/api/ai/functions/search-properties} with the body
 * {@code {"tenantId": ..., <arguments>}}. Endpoints answer
 * {@code {"success": bool, "data": ..., "message": "...", "error": "..."}}.
 *
 * <p>
 * Only the names listed in {@code locai.functions.names} are served, and only
 * when {@code locai.functions.base-url} is set.
 */
@Component
@Slf4j
public class HttpBusinessFunctionAdapter implements BusinessFunctionPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final MessagingProperties.FunctionsProperties functions;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpBusinessFunctionAdapter(MessagingProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.functions = properties.getFunctions();
        this.objectMapper = objectMapper;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(functions.getTimeout())
                .build();
    }

    @Override
    public boolean supports(String functionName) {
        return functions.getBaseUrl() != null && !functions.getBaseUrl().isBlank()
                && functions.getNames().contains(functionName);
    }

    @Override
    public CompletableFuture<FunctionResult> execute(String tenantId, String functionName,
            Map<String, Object> arguments) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Map<String, Object> payload = new LinkedHashMap<>(arguments);
                payload.put("tenantId", tenantId);
                String body = objectMapper.writeValueAsString(payload);

                Request.Builder requestBuilder = new Request.Builder()
                        .url(endpoint(functionName))
                        .post(RequestBody.create(body, JSON));
                if (functions.getApiKey() != null && !functions.getApiKey().isBlank()) {
                    requestBuilder.header("Authorization", "Bearer " + functions.getApiKey());
                }

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    return parseResponse(functionName, response);
                }
            } catch (IOException e) {
                log.warn("[Functions] {} failed: {}", functionName, e.getMessage());
                return FunctionResult.failure(functionName, e.getMessage());
            }
        });
    }

    private FunctionResult parseResponse(String functionName, Response response) throws IOException {
        ResponseBody responseBody = response.body();
        String raw = responseBody != null ? responseBody.string() : "";
        JsonNode node;
        try {
            node = raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return FunctionResult.failure(functionName, "Invalid JSON response (HTTP " + response.code() + ")");
        }

        if (!response.isSuccessful() || !node.path("success").asBoolean(response.isSuccessful())) {
            String error = node.path("error").asText("HTTP " + response.code());
            log.warn("[Functions] {} returned error: {}", functionName, error);
            return FunctionResult.failure(functionName, error);
        }

        JsonNode data = node.get("data");
        String message = node.hasNonNull("message") ? node.get("message").asText() : null;
        return FunctionResult.success(functionName, message,
                data != null ? objectMapper.convertValue(data, Object.class) : null);
    }

    private HttpUrl endpoint(String functionName) {
        HttpUrl base = HttpUrl.parse(functions.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid locai.functions.base-url: " + functions.getBaseUrl());
        }
        return base.newBuilder()
                .addPathSegment("api")
                .addPathSegment("ai")
                .addPathSegment("functions")
                .addPathSegment(functionName.replace('_', '-'))
                .build();
    }
}
