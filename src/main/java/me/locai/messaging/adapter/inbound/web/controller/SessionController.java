package me.locai.messaging.adapter.inbound.web.controller;

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
import me.locai.messaging.adapter.inbound.web.dto.SessionResponse;
import me.locai.messaging.domain.service.SessionManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.Supplier;

/**
 * Dashboard endpoints for a tenant's channel session.
 *
 * <p>
 * Every answer is {@code 200} with a {@code {success, data}} envelope. A
 * backend outage surfaces as {@code data.status = "error"} with a message, so
 * the dashboard keeps polling instead of failing.
 */
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private static final String MISSING_TENANT = "tenantId is required";

    private final SessionManager sessionManager;

    @GetMapping
    public Mono<ResponseEntity<SessionResponse>> getStatus(
            @RequestParam(required = false) String tenantId) {
        return withTenant(tenantId, () -> SessionResponse.of(sessionManager.getStatus(tenantId)));
    }

    @PostMapping
    public Mono<ResponseEntity<SessionResponse>> initialize(
            @RequestParam(required = false) String tenantId) {
        return withTenant(tenantId, () -> SessionResponse.of(sessionManager.initializeSession(tenantId)));
    }

    @DeleteMapping
    public Mono<ResponseEntity<SessionResponse>> disconnect(
            @RequestParam(required = false) String tenantId) {
        return withTenant(tenantId, () -> {
            SessionResponse response = SessionResponse.of(sessionManager.disconnect(tenantId));
            response.setMessage("Session disconnected");
            return response;
        });
    }

    private Mono<ResponseEntity<SessionResponse>> withTenant(String tenantId, Supplier<SessionResponse> action) {
        if (tenantId == null || tenantId.isBlank()) {
            return Mono.just(ResponseEntity.ok(SessionResponse.builder()
                    .success(false)
                    .error(MISSING_TENANT)
                    .build()));
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(action.get()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
