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

import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.domain.model.PairingResult;

/**
 * Handle to one tenant's session on a channel backend.
 *
 * <p>
 * Every method may throw {@link ChannelBackendException} when the backend is
 * unreachable or rejects the call. Implementations apply their own timeouts.
 */
public interface ChannelClient {

    /**
     * Identifier of the backend this handle talks to ({@code local},
     * {@code external}).
     */
    String getBackendId();

    String getTenantId();

    /**
     * Starts a pairing attempt.
     */
    PairingResult initializeSession();

    BackendStatus getConnectionStatus();

    /**
     * Tears the backend session down.
     */
    void disconnect();

    /**
     * Sends a text message to a client.
     *
     * @param to
     *            client phone number in any common format
     * @return backend message id
     */
    String send(String to, String text);
}
