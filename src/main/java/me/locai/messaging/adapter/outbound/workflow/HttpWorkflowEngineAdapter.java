package me.locai.messaging.adapter.outbound.workflow;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.WorkflowEngineException;
import me.locai.messaging.port.outbound.WorkflowPort;
import me.locai.messaging.security.HmacSigner;
import me.locai.messaging.security.LogMasking;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Workflow engine adapter: posts inbound messages to the engine's webhook.
 *
 * <p>
 * The body is signed with {@code X-Webhook-Signature: sha256=<hmac>} using the
 * shared secret, and the tenant is repeated in {@code X-Tenant-ID}. The engine
 * replies to the client on its own, so a 2xx answer completes the delivery.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>locai.workflow.url - engine webhook URL
 * <li>locai.workflow.secret - signing secret
 * <li>locai.workflow.timeout - call timeout (default 30s)
 * </ul>
 */
@Component
@Slf4j
public class HttpWorkflowEngineAdapter implements WorkflowPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String USER_AGENT = "LocAI-Gateway/1.0";

    private final MessagingProperties.WorkflowProperties workflow;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HttpWorkflowEngineAdapter(MessagingProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper, Clock clock) {
        this.workflow = properties.getWorkflow();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(workflow.getTimeout())
                .readTimeout(workflow.getTimeout())
                .build();
    }

    @Override
    public boolean isConfigured() {
        return workflow.isConfigured();
    }

    @Override
    public void dispatch(MessageEvent event) {
        if (!isConfigured()) {
            throw new WorkflowEngineException(WorkflowEngineException.Reason.NOT_CONFIGURED,
                    "Workflow engine URL or secret missing");
        }

        byte[] body = serialize(event);
        Request request = new Request.Builder()
                .url(workflow.getUrl())
                .header(HmacSigner.SIGNATURE_HEADER, HmacSigner.signatureHeaderValue(workflow.getSecret(), body))
                .header("X-Tenant-ID", event.tenantId())
                .header("User-Agent", USER_AGENT)
                .post(RequestBody.create(body, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new WorkflowEngineException(WorkflowEngineException.Reason.UNAVAILABLE,
                        "Workflow engine responded with HTTP " + response.code());
            }
            log.info("[Workflow] Message {} for tenant {} accepted (HTTP {})", event.messageId(),
                    LogMasking.maskTenant(event.tenantId()), response.code());
        } catch (InterruptedIOException e) {
            throw new WorkflowEngineException(WorkflowEngineException.Reason.TIMEOUT,
                    "Workflow engine timed out after " + workflow.getTimeout(), e);
        } catch (IOException e) {
            throw new WorkflowEngineException(WorkflowEngineException.Reason.UNAVAILABLE,
                    "Workflow engine unreachable: " + e.getMessage(), e);
        }
    }

    private byte[] serialize(MessageEvent event) {
        Instant receivedAt = event.receivedAt() != null ? event.receivedAt() : clock.instant();
        WorkflowPayload payload = new WorkflowPayload(
                event.tenantId(),
                new WorkflowMessage(event.from(), event.text(), event.messageId(), receivedAt.toString()),
                "message",
                workflow.getSource(),
                clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow payload", e);
        }
    }

    record WorkflowPayload(String tenantId, WorkflowMessage data, String event, String source,
            String webhookTimestamp) {
    }

    record WorkflowMessage(String from, String message, String messageId, String timestamp) {
    }
}
