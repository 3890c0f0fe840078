package me.locai.messaging.port.outbound;

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

/**
 * Per-tenant access to the active channel backend.
 */
public interface ChannelGateway {

    /**
     * Identifier of the active backend.
     */
    String getBackendId();

    /**
     * Returns the tenant's handle, creating it on first use. Concurrent callers
     * for one tenant get the same handle.
     */
    ChannelClient getClient(String tenantId);

    /**
     * Drops the tenant's handle; the next {@link #getClient} creates a new one.
     */
    void evict(String tenantId);

    /**
     * Sends a text message through the tenant's handle.
     *
     * @return backend message id
     * @throws ChannelBackendException
     *             if the backend rejects or cannot take the message
     */
    String send(String tenantId, String to, String text);
}
