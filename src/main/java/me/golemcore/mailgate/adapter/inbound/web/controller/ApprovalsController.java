package me.golemcore.mailgate.adapter.inbound.web.controller;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.mailgate.adapter.inbound.web.dto.DecisionReceipt;
import me.golemcore.mailgate.adapter.outbound.approval.PendingApprovalAdapter;
import me.golemcore.mailgate.domain.model.ApprovalRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Review channel endpoints: list held tool calls and answer them.
 *
 * <p>
 * The decision body is passed through untouched; any of the accepted payload
 * shapes works, e.g. {@code [{"type":"accept"}]} or
 * {@code {"type":"edit","args":{"args":{...}}}}.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
public class ApprovalsController {

    private final PendingApprovalAdapter approvalAdapter;

    @GetMapping
    public Mono<ResponseEntity<List<ApprovalRequest>>> listPending() {
        return Mono.fromCallable(approvalAdapter::listPending)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{requestId}")
    public Mono<ResponseEntity<DecisionReceipt>> submitDecision(@PathVariable String requestId,
            @RequestBody(required = false) JsonNode payload) {
        if (payload == null || payload.isNull()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Decision payload is required");
        }
        PendingApprovalAdapter.Delivery delivery = approvalAdapter.submitDecision(requestId, payload);
        return Mono.just(ResponseEntity.ok(receipt(requestId, delivery)));
    }

    @DeleteMapping("/{requestId}")
    public Mono<ResponseEntity<DecisionReceipt>> reject(@PathVariable String requestId,
            @RequestParam(required = false) String reason) {
        PendingApprovalAdapter.Delivery delivery = approvalAdapter.reject(requestId, reason);
        return Mono.just(ResponseEntity.ok(receipt(requestId, delivery)));
    }

    private DecisionReceipt receipt(String requestId, PendingApprovalAdapter.Delivery delivery) {
        return DecisionReceipt.builder()
                .requestId(requestId)
                .delivery(delivery.name())
                .build();
    }
}
