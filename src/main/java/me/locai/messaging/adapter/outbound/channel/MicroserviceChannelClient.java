package me.locai.messaging.adapter.outbound.channel;

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
import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.domain.model.PairingResult;
import me.locai.messaging.port.outbound.ChannelBackendException;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.security.LogMasking;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Channel client for one tenant backed by the channel microservice REST API.
 *
 * <p>
 * Endpoints (relative to the configured base URL):
 * <ul>
 * <li>POST /api/v1/sessions/{tenant}/start - start pairing
 * <li>GET /api/v1/sessions/{tenant}/status - connection status
 * <li>DELETE /api/v1/sessions/{tenant} - tear down the session
 * <li>POST /api/v1/messages/{tenant}/send - send a text message
 * </ul>
 *
 * Every request carries {@code Authorization: Bearer <apiKey>} and
 * {@code X-Tenant-ID}.
 */
@Slf4j
public class MicroserviceChannelClient implements ChannelClient {

    static final String BACKEND_ID = "external";
    static final String TENANT_HEADER = "X-Tenant-ID";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int NOT_FOUND = 404;

    private final String tenantId;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final OkHttpClient requestClient;
    private final OkHttpClient sendClient;
    private final ObjectMapper objectMapper;

    public MicroserviceChannelClient(String tenantId, HttpUrl baseUrl, String apiKey,
            OkHttpClient requestClient, OkHttpClient sendClient, ObjectMapper objectMapper) {
        this.tenantId = tenantId;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.requestClient = requestClient;
        this.sendClient = sendClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    @Override
    public PairingResult initializeSession() {
        Request request = newRequest("sessions", tenantId, "start")
                .post(RequestBody.create("{}", JSON))
                .build();
        JsonNode body = executeForJson(requestClient, request, "start session");
        JsonNode data = unwrap(body);
        return new PairingResult(text(data, "qrCode"), text(data, "status"));
    }

    @Override
    public BackendStatus getConnectionStatus() {
        Request request = newRequest("sessions", tenantId, "status").get().build();
        try (Response response = requestClient.newCall(request).execute()) {
            if (response.code() == NOT_FOUND) {
                return new BackendStatus(false, "not_found", null, null, null);
            }
            JsonNode body = readJson(response, "get status");
            JsonNode data = body.get("data");
            if (data == null || !data.isObject()) {
                throw new ChannelBackendException("Invalid status response from channel microservice");
            }
            return new BackendStatus(
                    data.path("connected").asBoolean(false),
                    text(data, "status"),
                    text(data, "qrCode"),
                    text(data, "phone"),
                    text(data, "businessName"));
        } catch (IOException e) {
            throw new ChannelBackendException("Channel microservice unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void disconnect() {
        Request request = newRequest("sessions", tenantId).delete().build();
        try (Response response = requestClient.newCall(request).execute()) {
            if (!response.isSuccessful() && response.code() != NOT_FOUND) {
                throw new ChannelBackendException("Disconnect failed: HTTP " + response.code());
            }
        } catch (IOException e) {
            throw new ChannelBackendException("Channel microservice unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public String send(String to, String text) {
        String recipient = PhoneNumberFormatter.format(to);
        String payload;
        try {
            payload = objectMapper.writeValueAsString(new SendRequest(recipient, text, "text"));
        } catch (JsonProcessingException e) {
            throw new ChannelBackendException("Failed to serialize outbound message", e);
        }
        Request request = newRequest("messages", tenantId, "send")
                .post(RequestBody.create(payload, JSON))
                .build();
        JsonNode body = executeForJson(sendClient, request, "send message");
        if (body.has("success") && !body.get("success").asBoolean()) {
            throw new ChannelBackendException("Channel microservice rejected message: "
                    + body.path("error").asText("unknown error"));
        }
        String messageId = text(body, "messageId");
        if (messageId == null) {
            messageId = text(unwrap(body), "messageId");
        }
        log.debug("[Channel] Sent message {} to {}", messageId, LogMasking.maskPhone(recipient));
        return messageId;
    }

    private Request.Builder newRequest(String... segments) {
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegment("api").addPathSegment("v1");
        for (String segment : segments) {
            url.addPathSegment(segment);
        }
        Request.Builder builder = new Request.Builder()
                .url(url.build())
                .header(TENANT_HEADER, tenantId);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private JsonNode executeForJson(OkHttpClient client, Request request, String operation) {
        try (Response response = client.newCall(request).execute()) {
            return readJson(response, operation);
        } catch (IOException e) {
            throw new ChannelBackendException("Channel microservice unreachable during " + operation
                    + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readJson(Response response, String operation) throws IOException {
        ResponseBody responseBody = response.body();
        String raw = responseBody != null ? responseBody.string() : "";
        if (!response.isSuccessful()) {
            log.warn("[Channel] {} failed for tenant {}: HTTP {}", operation,
                    LogMasking.maskTenant(tenantId), response.code());
            throw new ChannelBackendException(operation + " failed: HTTP " + response.code());
        }
        if (raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ChannelBackendException("Invalid JSON from channel microservice during " + operation, e);
        }
    }

    private static JsonNode unwrap(JsonNode body) {
        JsonNode data = body.get("data");
        return data != null && data.isObject() ? data : body;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    record SendRequest(String to, String message, String type) {
    }
}
