package me.golemcore.mailgate.adapter.outbound.approval;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.ApprovalRejectedException;
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.model.ApprovalRequest;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import me.golemcore.mailgate.port.outbound.ApprovalPort;
import me.golemcore.mailgate.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Review channel backed by the REST API. Held calls wait here until a decision
 * is submitted out of band.
 *
 * <p>
 * Every pending request is persisted as {@code approvals/<id>.json}. A decision
 * submitted for a request whose run is not waiting in this process (for
 * example after a restart) is persisted as {@code approvals/<id>.decision.json}
 * and handed over when the run is replayed and asks again under the same
 * request id. Outright rejections are kept the same way as
 * {@code approvals/<id>.rejected.txt}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code gate.approval.timeout} - how long a run waits; {@code 0} waits
 * indefinitely
 * </ul>
 */
@Component
@Slf4j
public class PendingApprovalAdapter implements ApprovalPort {

    private static final String APPROVALS_DIR = "approvals";
    private static final String REQUEST_SUFFIX = ".json";
    private static final String DECISION_SUFFIX = ".decision.json";
    private static final String REJECTION_SUFFIX = ".rejected.txt";

    /** What happened to a submitted decision. */
    public enum Delivery {
        /** Handed to a run waiting in this process. */
        DELIVERED,
        /** Persisted until the run is replayed. */
        STORED_FOR_REPLAY
    }

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final Object registrationLock = new Object();
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public PendingApprovalAdapter(StoragePort storagePort, ObjectMapper objectMapper, GateProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.timeout = properties.getApproval().getTimeout();
        log.info("[Approvals] Review timeout: {}", timeout == null || timeout.isZero() ? "none" : timeout);
    }

    @Override
    public CompletableFuture<JsonNode> requestApproval(ApprovalRequest request) {
        String requestId = request.requestId();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        PendingApproval entry = new PendingApproval(request, future);

        synchronized (registrationLock) {
            Optional<String> storedRejection = readStored(requestId, REJECTION_SUFFIX);
            if (storedRejection.isPresent()) {
                log.info("[Approvals] Replaying stored rejection for {}", requestId);
                deleteFiles(requestId);
                return CompletableFuture.failedFuture(new ApprovalRejectedException(storedRejection.get()));
            }
            Optional<JsonNode> storedDecision = readStored(requestId, DECISION_SUFFIX).flatMap(this::parse);
            if (storedDecision.isPresent()) {
                log.info("[Approvals] Replaying stored decision for {}", requestId);
                deleteFiles(requestId);
                return CompletableFuture.completedFuture(storedDecision.get());
            }

            // Registered before the request becomes visible, so any decision
            // submitted from now on reaches this future.
            PendingApproval previous = pending.put(requestId, entry);
            if (previous != null) {
                previous.future().completeExceptionally(new ApprovalRejectedException("Superseded by a new request"));
            }
            try {
                persistRequest(request);
            } catch (StoreUnavailableException e) {
                pending.remove(requestId, entry);
                throw e;
            }
        }
        log.info("[Approvals] Waiting for decision on {} ({})", requestId, request.toolCall().getName());

        CompletableFuture<JsonNode> result = timeout != null && !timeout.isZero() && !timeout.isNegative()
                ? future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                : future;
        return result.whenComplete((payload, error) -> {
            pending.remove(requestId, entry);
            deleteFiles(requestId);
            if (error != null) {
                log.info("[Approvals] Request {} closed without decision: {}", requestId, error.toString());
            }
        });
    }

    /**
     * Delivers a raw decision payload.
     *
     * @throws IllegalArgumentException
     *             if no such request is pending
     * @throws StoreUnavailableException
     *             if the decision has to be stored and cannot be
     */
    public Delivery submitDecision(String requestId, JsonNode payload) {
        PendingApproval waiting;
        synchronized (registrationLock) {
            waiting = pending.remove(requestId);
            if (waiting == null) {
                requireStoredRequest(requestId);
                write(requestId, DECISION_SUFFIX, payload.toString());
                log.info("[Approvals] Decision for {} stored for replay", requestId);
                return Delivery.STORED_FOR_REPLAY;
            }
        }
        waiting.future().complete(payload);
        log.info("[Approvals] Decision delivered for {}", requestId);
        return Delivery.DELIVERED;
    }

    /**
     * Withdraws a request without a decision. The run records the call as
     * rejected.
     *
     * @throws IllegalArgumentException
     *             if no such request is pending
     */
    public Delivery reject(String requestId, String reason) {
        String text = reason != null && !reason.isBlank() ? reason : "Rejected by reviewer";
        PendingApproval waiting;
        synchronized (registrationLock) {
            waiting = pending.remove(requestId);
            if (waiting == null) {
                requireStoredRequest(requestId);
                write(requestId, REJECTION_SUFFIX, text);
                log.info("[Approvals] Rejection for {} stored for replay", requestId);
                return Delivery.STORED_FOR_REPLAY;
            }
        }
        waiting.future().completeExceptionally(new ApprovalRejectedException(text));
        log.info("[Approvals] Request {} rejected", requestId);
        return Delivery.DELIVERED;
    }

    /**
     * All requests awaiting a decision, including those of runs that are not
     * executing in this process, oldest first.
     */
    public List<ApprovalRequest> listPending() {
        List<ApprovalRequest> requests = new ArrayList<>();
        for (String name : storagePort.listObjects(APPROVALS_DIR, "").join()) {
            if (!name.endsWith(REQUEST_SUFFIX) || name.endsWith(DECISION_SUFFIX)) {
                continue;
            }
            String json = storagePort.getText(APPROVALS_DIR, name).join();
            if (json == null) {
                continue;
            }
            try {
                requests.add(objectMapper.readValue(json, ApprovalRequest.class));
            } catch (JsonProcessingException e) {
                log.warn("[Approvals] Skipping unreadable request {}: {}", name, e.getOriginalMessage());
            }
        }
        requests.sort(Comparator.comparing(ApprovalRequest::createdAt,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return requests;
    }

    private void requireStoredRequest(String requestId) {
        boolean known;
        try {
            known = storagePort.exists(APPROVALS_DIR, fileName(requestId, REQUEST_SUFFIX)).join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to look up approval request " + requestId, e.getCause());
        }
        if (!known) {
            throw new IllegalArgumentException("Unknown approval request: " + requestId);
        }
    }

    private void persistRequest(ApprovalRequest request) {
        String json;
        try {
            json = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Failed to serialize approval request " + request.requestId(), e);
        }
        write(request.requestId(), REQUEST_SUFFIX, json);
    }

    private void write(String requestId, String suffix, String content) {
        String name = fileName(requestId, suffix);
        try {
            storagePort.putTextAtomic(APPROVALS_DIR, name, content, false).join();
        } catch (CompletionException e) {
            log.error("[Approvals] Failed to write {}", name, e.getCause());
            throw new StoreUnavailableException("Failed to write approval file " + name, e.getCause());
        }
    }

    private Optional<String> readStored(String requestId, String suffix) {
        try {
            return Optional.ofNullable(storagePort.getText(APPROVALS_DIR, fileName(requestId, suffix)).join());
        } catch (CompletionException e) {
            log.warn("[Approvals] Failed to read stored {} for {}", suffix, requestId, e);
            return Optional.empty();
        }
    }

    private Optional<JsonNode> parse(String json) {
        try {
            return Optional.of(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("[Approvals] Stored decision is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void deleteFiles(String requestId) {
        for (String suffix : List.of(REQUEST_SUFFIX, DECISION_SUFFIX, REJECTION_SUFFIX)) {
            try {
                storagePort.deleteObject(APPROVALS_DIR, fileName(requestId, suffix)).join();
            } catch (CompletionException e) {
                log.warn("[Approvals] Failed to delete {}{}", requestId, suffix, e);
            }
        }
    }

    static String fileName(String requestId, String suffix) {
        return requestId.replaceAll("[^A-Za-z0-9_.-]", "_") + suffix;
    }

    private record PendingApproval(ApprovalRequest request, CompletableFuture<JsonNode> future) {
    }
}
