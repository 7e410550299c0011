package me.golemcore.mailgate.domain.service;

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
import me.golemcore.mailgate.domain.model.AgentContext;
import me.golemcore.mailgate.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Persists run state as {@code runs/<runId>.json}. A checkpoint holds the full
 * history and, while suspended, the continuation token naming the decision the
 * run waits for; that is everything needed to replay the run after a restart.
 */
@Service
@Slf4j
public class RunCheckpointService {

    private static final String RUNS_DIR = "runs";
    private static final String EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunCheckpointService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Writes the checkpoint. Failures are logged; the run continues on its
     * in-memory state.
     */
    public void save(AgentContext context) {
        context.setUpdatedAt(clock.instant());
        try {
            String json = objectMapper.writeValueAsString(context);
            storagePort.putTextAtomic(RUNS_DIR, context.getRunId() + EXTENSION, json, false).join();
        } catch (JsonProcessingException | CompletionException e) {
            log.error("[Storage] Failed to checkpoint run {}", context.getRunId(), e);
        }
    }

    public Optional<AgentContext> load(String runId) {
        try {
            String json = storagePort.getText(RUNS_DIR, runId + EXTENSION).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, AgentContext.class));
        } catch (JsonProcessingException | CompletionException e) {
            log.error("[Storage] Failed to load checkpoint of run {}", runId, e);
            return Optional.empty();
        }
    }

    public List<String> listRunIds() {
        List<String> ids = new ArrayList<>();
        try {
            for (String name : storagePort.listObjects(RUNS_DIR, "").join()) {
                if (name.endsWith(EXTENSION)) {
                    ids.add(name.substring(0, name.length() - EXTENSION.length()));
                }
            }
        } catch (CompletionException e) {
            log.error("[Storage] Failed to list run checkpoints", e);
        }
        return ids;
    }
}
