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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.cache.ExpiringCache;
import me.locai.messaging.domain.model.AgentReply;
import me.locai.messaging.domain.model.AgentRequest;
import me.locai.messaging.domain.model.CompletionRequest;
import me.locai.messaging.domain.model.CompletionResult;
import me.locai.messaging.domain.model.ConversationContext;
import me.locai.messaging.domain.model.ConversationMessage;
import me.locai.messaging.domain.model.ConversationStage;
import me.locai.messaging.domain.model.FunctionCall;
import me.locai.messaging.domain.model.FunctionResult;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.CompletionPort;
import me.locai.messaging.port.outbound.DocumentStorePort;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Conversation agent runtime: answers client messages on behalf of a tenant.
 *
 * <p>
 * Holds one {@link ConversationContext} per (tenant, client) in a bounded
 * cache with idle expiry. Every access to a context happens inside that key's
 * lane, a fair lock from {@link KeyedLockRegistry}, so concurrent messages
 * from one client are processed one after the other and never lose an
 * append.
 *
 * <p>
 * A turn:
 * <ol>
 * <li>look up or create the context, rehydrating it from the document store
 * on a cache miss (with a shorter wait when heavy processing is skipped)</li>
 * <li>answer a message id seen before with an empty reply, unless
 * deduplication is bypassed</li>
 * <li>append the client message</li>
 * <li>classify it and select business functions</li>
 * <li>run the selected functions</li>
 * <li>compose the reply from the draft and successful function messages,
 * append it, merge extracted slots and advance the stage</li>
 * <li>persist the context (best effort)</li>
 * </ol>
 *
 * Completion and function calls share the turn's time budget. Any failure
 * produces the configured fallback reply instead of an exception.
 */
@Service
@Slf4j
public class ConversationAgentService {

    static final String COLLECTION = "conversations";
    static final String INTENT_FALLBACK = "fallback";

    private static final String REPLY_SEPARATOR = "\n\n";
    private static final long REHYDRATE_TIMEOUT_MS = 2000;
    private static final long QUICK_REHYDRATE_TIMEOUT_MS = 500;

    private final CompletionPort completionPort;
    private final BusinessFunctionRegistry functionRegistry;
    private final DocumentStorePort documentStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MessagingProperties.AgentProperties agent;

    private final ExpiringCache<ConversationKey, ConversationContext> contexts;
    private final KeyedLockRegistry<ConversationKey> lanes = new KeyedLockRegistry<>();

    public ConversationAgentService(CompletionPort completionPort, BusinessFunctionRegistry functionRegistry,
            DocumentStorePort documentStore, ObjectMapper objectMapper, MessagingProperties properties,
            Clock clock) {
        this.completionPort = completionPort;
        this.functionRegistry = functionRegistry;
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.agent = properties.getAgent();
        this.contexts = new ExpiringCache<>(clock, agent.getContextIdleTtl(), agent.getMaxContexts(), true);
    }

    /**
     * Runs {@code work} while holding the lane of the given client.
     *
     * @throws LaneUnavailableException
     *             if the lane could not be acquired within
     *             {@code locai.agent.lane-timeout}
     */
    public <T> T inLane(String tenantId, String clientKey, Supplier<T> work) {
        ConversationKey key = new ConversationKey(tenantId, clientKey);
        Optional<KeyedLockRegistry<ConversationKey>.Lease> lease;
        try {
            lease = lanes.tryAcquire(key, agent.getLaneTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LaneUnavailableException("Interrupted while waiting for lane");
        }
        if (lease.isEmpty()) {
            throw new LaneUnavailableException("Lane busy for more than " + agent.getLaneTimeout());
        }
        try (KeyedLockRegistry<ConversationKey>.Lease held = lease.get()) {
            return work.get();
        }
    }

    /**
     * Processes one client message and returns the reply. Never throws.
     */
    public AgentReply processMessage(AgentRequest request) {
        Instant deadline = clock.instant().plus(request.getBudget() != null
                ? request.getBudget()
                : agent.getRequestTimeout());
        try {
            return inLane(request.getTenantId(), request.getClientKey(), () -> processInLane(request, deadline));
        } catch (LaneUnavailableException e) {
            log.warn("[Agent] {} for client {}", e.getMessage(), LogMasking.maskPhone(request.getClientKey()));
            return fallbackReply(null);
        }
    }

    /**
     * Forgets the conversation in memory and in the document store.
     *
     * @return {@code true} if a context was held in memory
     */
    public boolean clearContext(String tenantId, String clientKey) {
        return inLane(tenantId, clientKey, () -> {
            ConversationKey key = new ConversationKey(tenantId, clientKey);
            boolean existed = contexts.remove(key).isPresent();
            documentStore.deleteDocument(COLLECTION, key.documentId())
                    .exceptionally(e -> {
                        log.warn("[Agent] Failed to delete stored context: {}", e.getMessage());
                        return null;
                    });
            log.info("[Agent] Cleared context for client {}", LogMasking.maskPhone(clientKey));
            return existed;
        });
    }

    /**
     * Drops contexts idle for longer than {@code locai.agent.context-idle-ttl}.
     * Persisted copies are kept and rehydrated on the next message.
     */
    public int purgeIdleContexts() {
        return contexts.purgeExpired();
    }

    /**
     * Copy of the client's in-memory context, if any.
     */
    public Optional<ConversationContext> findContext(String tenantId, String clientKey) {
        return inLane(tenantId, clientKey, () -> contexts.get(new ConversationKey(tenantId, clientKey))
                .map(this::copyOf));
    }

    private AgentReply processInLane(AgentRequest request, Instant deadline) {
        ConversationKey key = new ConversationKey(request.getTenantId(), request.getClientKey());
        ConversationContext context = contexts.get(key)
                .orElseGet(() -> loadOrCreate(key, request.isSkipHeavyProcessing()));
        contexts.put(key, context);

        if (!request.isBypassDeduplication() && context.containsMessageId(request.getMessageId())) {
            log.info("[Agent] Message {} already answered for client {}", request.getMessageId(),
                    LogMasking.maskPhone(key.clientKey()));
            return AgentReply.empty(context.getStage());
        }

        Instant now = clock.instant();
        context.append(ConversationMessage.builder()
                .id(request.getMessageId() != null ? request.getMessageId() : UUID.randomUUID().toString())
                .role(ConversationMessage.ROLE_USER)
                .content(request.getText())
                .timestamp(now)
                .build());

        AgentReply reply;
        try {
            reply = runTurn(request, context, deadline);
        } catch (RuntimeException e) {
            log.warn("[Agent] Turn failed for client {}: {}", LogMasking.maskPhone(key.clientKey()),
                    e.getMessage());
            reply = fallbackReply(context.getStage());
        }

        if (reply.hasReply()) {
            context.append(ConversationMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .role(ConversationMessage.ROLE_ASSISTANT)
                    .content(reply.getReply())
                    .timestamp(clock.instant())
                    .build());
        }
        contexts.put(key, context);
        persist(key, context);
        return reply;
    }

    private AgentReply runTurn(AgentRequest request, ConversationContext context, Instant deadline) {
        CompletionRequest completionRequest = new CompletionRequest(
                request.getTenantId(),
                request.getText(),
                context.recent(agent.getHistoryWindow()),
                context.getStage(),
                context.getExtractedInfo(),
                functionRegistry.availableFunctions());

        CompletionResult completion = await(completionPort.classifyAndDispatch(completionRequest), deadline,
                "completion");
        context.addTokens(completion.getTokensUsed());
        context.mergeExtractedInfo(completion.getExtractedInfo());

        List<FunctionResult> results = runFunctions(request.getTenantId(), completion.getFunctionCalls(), deadline);
        List<String> executed = new ArrayList<>();
        StringBuilder reply = new StringBuilder(completion.getReplyDraft() != null
                ? completion.getReplyDraft().trim()
                : "");
        for (FunctionResult result : results) {
            if (!result.success()) {
                continue;
            }
            executed.add(result.name());
            if (result.message() != null && !result.message().isBlank()) {
                if (reply.length() > 0) {
                    reply.append(REPLY_SEPARATOR);
                }
                reply.append(result.message().trim());
            }
        }

        ConversationStage stage = ConversationStageResolver.resolve(context.getStage(),
                completion.getSuggestedStage(), results);
        if (stage != context.getStage()) {
            log.debug("[Agent] Stage {} -> {}", context.getStage().getWireName(), stage.getWireName());
        }
        context.advanceStage(stage);

        log.info("[Agent] Intent {} for client {}, functions {}", completion.getIntent(),
                LogMasking.maskPhone(request.getClientKey()), executed);
        return AgentReply.builder()
                .reply(reply.toString())
                .tokensUsed(completion.getTokensUsed())
                .functionsExecuted(executed)
                .intent(completion.getIntent())
                .stage(context.getStage().getWireName())
                .fallbackUsed(false)
                .build();
    }

    private List<FunctionResult> runFunctions(String tenantId, List<FunctionCall> calls, Instant deadline) {
        if (calls == null || calls.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<FunctionResult>> futures = new ArrayList<>();
        for (FunctionCall call : calls) {
            futures.add(functionRegistry.execute(tenantId, call));
        }
        List<FunctionResult> results = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            String name = calls.get(i).name();
            try {
                FunctionResult result = await(futures.get(i), deadline, name);
                results.add(result != null ? result : FunctionResult.failure(name, "no result"));
            } catch (RuntimeException e) {
                log.warn("[Agent] Function {} failed: {}", name, e.getMessage());
                results.add(FunctionResult.failure(name, e.getMessage()));
            }
        }
        return results;
    }

    private <T> T await(CompletableFuture<T> future, Instant deadline, String what) {
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            future.cancel(true);
            throw new IllegalStateException("No time left for " + what);
        }
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException(what + " timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException(what + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(what + " interrupted", e);
        }
    }

    private AgentReply fallbackReply(ConversationStage stage) {
        return AgentReply.builder()
                .reply(agent.getFallbackReply())
                .intent(INTENT_FALLBACK)
                .stage(stage != null ? stage.getWireName() : null)
                .fallbackUsed(true)
                .build();
    }

    /**
     * Restores the stored context after a restart or idle eviction. A context
     * created because the store could not be read is marked detached and never
     * written back, so it cannot replace the stored history.
     */
    private ConversationContext loadOrCreate(ConversationKey key, boolean quick) {
        long timeoutMs = quick ? QUICK_REHYDRATE_TIMEOUT_MS : REHYDRATE_TIMEOUT_MS;
        String json;
        try {
            json = documentStore.getDocument(COLLECTION, key.documentId()).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return detached(key);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[Agent] Could not rehydrate context for client {}: {}", LogMasking.maskPhone(key.clientKey()),
                    e.getMessage());
            return detached(key);
        }
        if (json == null) {
            return ConversationContext.create(key.tenantId(), key.clientKey());
        }
        try {
            ConversationContext restored = objectMapper.readValue(json, ConversationContext.class);
            log.debug("[Agent] Rehydrated context for client {} ({} messages)",
                    LogMasking.maskPhone(key.clientKey()), restored.getMessages().size());
            return restored;
        } catch (JsonProcessingException e) {
            // unreadable document, nothing left to protect
            log.warn("[Agent] Discarding corrupt context for client {}: {}", LogMasking.maskPhone(key.clientKey()),
                    e.getMessage());
            return ConversationContext.create(key.tenantId(), key.clientKey());
        }
    }

    private static ConversationContext detached(ConversationKey key) {
        ConversationContext context = ConversationContext.create(key.tenantId(), key.clientKey());
        context.setDetached(true);
        return context;
    }

    private void persist(ConversationKey key, ConversationContext context) {
        if (context.isDetached()) {
            log.debug("[Agent] Not persisting detached context for client {}", LogMasking.maskPhone(key.clientKey()));
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("[Agent] Failed to serialize context: {}", e.getMessage());
            return;
        }
        documentStore.putDocument(COLLECTION, key.documentId(), json)
                .exceptionally(e -> {
                    log.warn("[Agent] Failed to persist context for client {}: {}",
                            LogMasking.maskPhone(key.clientKey()), e.getMessage());
                    return null;
                });
    }

    private ConversationContext copyOf(ConversationContext context) {
        return ConversationContext.builder()
                .tenantId(context.getTenantId())
                .clientKey(context.getClientKey())
                .stage(context.getStage())
                .messages(new ArrayList<>(context.getMessages()))
                .extractedInfo(new LinkedHashMap<>(context.getExtractedInfo()))
                .lastMessageAt(context.getLastMessageAt())
                .tokensUsed(context.getTokensUsed())
                .detached(context.isDetached())
                .build();
    }

    record ConversationKey(String tenantId, String clientKey) {

        String documentId() {
            return tenantId + ":" + clientKey;
        }
    }
}
