package me.locai.messaging.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the messaging gateway, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code locai.*} prefix:
 * <ul>
 * <li>{@link WebhookProperties} - inbound webhook credentials and limits</li>
 * <li>{@link WorkflowProperties} - primary external workflow engine</li>
 * <li>{@link ChannelProperties} - channel backend selection and endpoints</li>
 * <li>{@link SessionProperties} - pairing lifecycle timings</li>
 * <li>{@link DedupProperties} - processed-message cache</li>
 * <li>{@link AgentProperties} - conversation agent runtime</li>
 * <li>{@link AiProperties} - completion provider</li>
 * <li>{@link FunctionsProperties} - business function endpoints</li>
 * <li>{@link StorageProperties} - local document store</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "locai")
@Data
public class MessagingProperties {

    private WebhookProperties webhook = new WebhookProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private ChannelProperties channel = new ChannelProperties();
    private SessionProperties session = new SessionProperties();
    private DedupProperties dedup = new DedupProperties();
    private AgentProperties agent = new AgentProperties();
    private AiProperties ai = new AiProperties();
    private FunctionsProperties functions = new FunctionsProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WebhookProperties {
        /** Static bearer token accepted in {@code Authorization}. */
        private String token;
        /** Secret for {@code X-Webhook-Signature: sha256=<hex>} verification. */
        private String secret;
        /** Token expected by the {@code GET /webhook} verification handshake. */
        private String verifyToken = "locai-webhook-verify";
        private int maxPayloadSize = 256 * 1024;
    }

    @Data
    public static class WorkflowProperties {
        private String url;
        private String secret;
        private String source = "whatsapp-microservice";
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isConfigured() {
            return url != null && !url.isBlank() && secret != null && !secret.isBlank();
        }
    }

    @Data
    public static class ChannelProperties {
        /** {@code external} (channel microservice) or {@code local} (loopback). */
        private String backend = "external";
        private String baseUrl = "http://localhost:3000";
        private String apiKey;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration sendTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class SessionProperties {
        private Duration initCooldown = Duration.ofSeconds(30);
        private Duration pairingCodeTtl = Duration.ofSeconds(60);
        private Duration statusTtl = Duration.ofSeconds(5);
        private int pollMaxAttempts = 10;
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration pollTimeout = Duration.ofSeconds(25);
    }

    @Data
    public static class DedupProperties {
        private Duration ttl = Duration.ofMinutes(5);
        private int maxEntries = 10_000;
    }

    @Data
    public static class AgentProperties {
        /** Budget for one fallback turn, independent of the workflow timeout. */
        private Duration fallbackTimeout = Duration.ofSeconds(20);
        /** Budget for a direct {@code POST /agent} turn. */
        private Duration requestTimeout = Duration.ofSeconds(45);
        /** Max wait for the per-client lane before giving up. */
        private Duration laneTimeout = Duration.ofSeconds(25);
        private Duration contextIdleTtl = Duration.ofHours(24);
        private int maxContexts = 5_000;
        /** Number of recent messages passed to the completion service. */
        private int historyWindow = 10;
        private String fallbackReply = "Thanks for your message! Let me check a few details and get back to you shortly.";
    }

    @Data
    public static class AiProperties {
        /** {@code langchain4j} or {@code keyword}. */
        private String provider = "keyword";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class FunctionsProperties {
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(8);
        private List<String> names = new ArrayList<>(List.of(
                "search_properties",
                "get_property_details",
                "check_availability",
                "calculate_total_price",
                "register_client",
                "schedule_visit",
                "create_reservation",
                "apply_discount"));
    }

    @Data
    public static class StorageProperties {
        private boolean enabled = true;
        private String basePath = "${user.home}/.locai/messaging";
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** Upper bound per read; adapters tighten it with their own call timeouts. */
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration writeTimeout = Duration.ofSeconds(30);
        private int maxIdleConnections = 10;
        private Duration keepAlive = Duration.ofMinutes(5);
        /** Calls slower than this are logged at INFO. */
        private Duration slowCallThreshold = Duration.ofSeconds(5);
    }
}
