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

import me.locai.messaging.domain.model.MessageEvent;

/**
 * Port for the external workflow engine that normally handles inbound
 * messages.
 */
public interface WorkflowPort {

    /**
     * Whether both the engine URL and the signing secret are configured.
     */
    boolean isConfigured();

    /**
     * Hands the message to the engine.
     *
     * @throws WorkflowEngineException
     *             if the engine is not configured, times out or answers with a
     *             non-2xx status
     */
    void dispatch(MessageEvent event);
}
