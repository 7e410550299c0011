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

import lombok.RequiredArgsConstructor;
import me.golemcore.mailgate.adapter.inbound.web.dto.RunSummaryDto;
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.domain.model.EmailInput;
import me.golemcore.mailgate.domain.service.AgentRunCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Starts runs for incoming emails and reports their progress.
 */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunsController {

    private final AgentRunCoordinator runCoordinator;

    @PostMapping
    public Mono<ResponseEntity<RunSummaryDto>> startRun(@RequestBody(required = false) EmailInput email) {
        if (email == null || isBlank(email.emailThread())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "emailThread is required");
        }
        AgentContext context = runCoordinator.startRun(email);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(RunSummaryDto.from(context, true)));
    }

    @PostMapping("/{runId}/resume")
    public Mono<ResponseEntity<RunSummaryDto>> resumeRun(@PathVariable String runId) {
        AgentContext context = runCoordinator.resumeRun(runId);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(RunSummaryDto.from(context, true)));
    }

    @GetMapping("/{runId}")
    public Mono<ResponseEntity<RunSummaryDto>> getRun(@PathVariable String runId) {
        return Mono.just(runCoordinator.getRun(runId)
                .map(ctx -> ResponseEntity.ok(RunSummaryDto.from(ctx, runCoordinator.isActive(runId))))
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId)));
    }

    @GetMapping("/{runId}/messages")
    public Mono<ResponseEntity<AgentContext>> getRunDetail(@PathVariable String runId) {
        return Mono.just(runCoordinator.getRun(runId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
