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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.port.outbound.ChannelClientProvider;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Creates {@link MicroserviceChannelClient} handles. The HTTP clients are
 * derived once from the shared client, with the request and send timeouts
 * applied as call timeouts.
 */
@Component
public class MicroserviceChannelClientProvider implements ChannelClientProvider {

    private final MessagingProperties.ChannelProperties channel;
    private final OkHttpClient requestClient;
    private final OkHttpClient sendClient;
    private final ObjectMapper objectMapper;

    public MicroserviceChannelClientProvider(MessagingProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.channel = properties.getChannel();
        this.objectMapper = objectMapper;
        this.requestClient = baseHttpClient.newBuilder()
                .callTimeout(channel.getRequestTimeout())
                .build();
        this.sendClient = baseHttpClient.newBuilder()
                .callTimeout(channel.getSendTimeout())
                .build();
    }

    @Override
    public String getBackendId() {
        return MicroserviceChannelClient.BACKEND_ID;
    }

    @Override
    public ChannelClient create(String tenantId) {
        HttpUrl baseUrl = HttpUrl.parse(channel.getBaseUrl());
        if (baseUrl == null) {
            throw new IllegalStateException("Invalid locai.channel.base-url: " + channel.getBaseUrl());
        }
        return new MicroserviceChannelClient(tenantId, baseUrl, channel.getApiKey(), requestClient, sendClient,
                objectMapper);
    }
}
