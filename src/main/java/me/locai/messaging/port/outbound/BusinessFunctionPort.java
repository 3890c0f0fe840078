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

import me.locai.messaging.domain.model.FunctionResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the platform's business functions (property search, pricing,
 * reservations and the like).
 */
public interface BusinessFunctionPort {

    boolean supports(String functionName);

    /**
     * Executes the function for the tenant. Failures are reported as
     * {@link FunctionResult#failure} or as an exceptionally completed future.
     */
    CompletableFuture<FunctionResult> execute(String tenantId, String functionName, Map<String, Object> arguments);
}
