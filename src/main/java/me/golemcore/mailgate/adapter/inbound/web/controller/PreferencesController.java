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
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.service.PreferenceStoreService;
import me.golemcore.mailgate.domain.service.PromptResources;
import me.golemcore.mailgate.infrastructure.config.GateProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the learned preference profiles, keyed by namespace path.
 * Namespaces that were never updated show their default text.
 */
@RestController
@RequestMapping("/api/preferences")
@RequiredArgsConstructor
public class PreferencesController {

    private final PreferenceStoreService preferenceStore;
    private final PromptResources promptResources;
    private final GateProperties properties;

    @GetMapping
    public Mono<ResponseEntity<Map<String, String>>> getProfiles() {
        return Flux.fromIterable(namespaces())
                .concatMap(namespace -> Mono.fromFuture(
                        () -> preferenceStore.getProfileAsync(namespace, promptResources.defaultProfile(namespace)))
                        .map(profile -> Map.entry(namespace.path(), profile)))
                .<Map<String, String>>collect(LinkedHashMap::new,
                        (profiles, entry) -> profiles.put(entry.getKey(), entry.getValue()))
                .map(ResponseEntity::ok);
    }

    private List<MemoryNamespace> namespaces() {
        GateProperties.MemoryProperties memory = properties.getMemory();
        return List.of(MemoryNamespace.parse(memory.getTriageNamespace()),
                MemoryNamespace.parse(memory.getResponseNamespace()),
                MemoryNamespace.parse(memory.getCalendarNamespace()));
    }
}
