package me.locai.messaging.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.DeliveryResult;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.port.outbound.WorkflowEngineException;
import me.locai.messaging.port.outbound.WorkflowPort;
import org.springframework.stereotype.Component;

/**
 * Primary route: hand the message to the external workflow engine, which
 * replies to the client itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowEngineStrategy implements RoutingStrategy {

    static final String NAME = "workflow";

    private final WorkflowPort workflowPort;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(MessageEvent event) {
        try {
            workflowPort.dispatch(event);
            return DeliveryResult.delivered(NAME, false);
        } catch (WorkflowEngineException e) {
            log.warn("[Router] Workflow engine failed ({}): {}", e.getReason().getCode(), e.getMessage());
            return DeliveryResult.failed(NAME, e.getReason().getCode());
        } catch (RuntimeException e) {
            log.warn("[Router] Workflow engine call failed: {}", e.getMessage());
            return DeliveryResult.failed(NAME, WorkflowEngineException.Reason.UNAVAILABLE.getCode());
        }
    }
}
