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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mailgate.domain.exception.StoreUnavailableException;
import me.golemcore.mailgate.domain.exception.SynthesizerException;
import me.golemcore.mailgate.domain.model.MemoryNamespace;
import me.golemcore.mailgate.domain.model.Message;
import me.golemcore.mailgate.port.outbound.PreferenceSynthesizerPort;
import me.golemcore.mailgate.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Namespaced store of preference profiles.
 *
 * <p>
 * Reads fall back to a caller-supplied default, which is never written. The
 * only write path is {@link #updateProfile}: a read-modify-write through the
 * {@link PreferenceSynthesizerPort} under a per-namespace lock, so concurrent
 * updates to the same namespace never lose each other while different
 * namespaces proceed independently.
 *
 * <p>
 * Profiles are stored as {@code preferences/<segment>/.../<leaf>.md} and
 * written atomically, keeping the previous version as {@code .bak}.
 */
@Service
@Slf4j
public class PreferenceStoreService {

    private static final String PREFERENCES_DIR = "preferences";
    private static final String PROFILE_EXTENSION = ".md";

    private final StoragePort storagePort;
    private final PreferenceSynthesizerPort synthesizer;
    private final PromptResources promptResources;

    private final Map<MemoryNamespace, ReentrantLock> locks = new ConcurrentHashMap<>();

    public PreferenceStoreService(StoragePort storagePort, PreferenceSynthesizerPort synthesizer,
            PromptResources promptResources) {
        this.storagePort = storagePort;
        this.synthesizer = synthesizer;
        this.promptResources = promptResources;
    }

    /**
     * Returns the stored profile, or the namespace's shipped default.
     */
    public String getProfile(MemoryNamespace namespace) {
        return getProfile(namespace, promptResources.defaultProfile(namespace));
    }

    /**
     * Returns the stored profile, or {@code defaultProfile} when nothing has been
     * stored yet. The default is not persisted.
     *
     * @throws StoreUnavailableException
     *             if the storage could not be read
     */
    public String getProfile(MemoryNamespace namespace, String defaultProfile) {
        String stored = readStored(namespace);
        return stored != null ? stored : defaultProfile;
    }

    public CompletableFuture<String> getProfileAsync(MemoryNamespace namespace, String defaultProfile) {
        return CompletableFuture.supplyAsync(() -> getProfile(namespace, defaultProfile));
    }

    /**
     * Rewrites the profile with the namespace's shipped default as the starting
     * point when nothing has been stored yet.
     */
    public String updateProfile(MemoryNamespace namespace, List<Message> feedbackMessages) {
        return updateProfile(namespace, promptResources.defaultProfile(namespace), feedbackMessages);
    }

    /**
     * Merges feedback into the profile and persists the result.
     *
     * @return the profile as stored
     * @throws SynthesizerException
     *             if the synthesizer failed or returned nothing; the stored profile
     *             is unchanged
     * @throws StoreUnavailableException
     *             if the storage could not be read or written
     */
    public String updateProfile(MemoryNamespace namespace, String defaultProfile, List<Message> feedbackMessages) {
        ReentrantLock lock = locks.computeIfAbsent(namespace, ns -> new ReentrantLock());
        lock.lock();
        try {
            String current = getProfile(namespace, defaultProfile);
            String synthesized = synthesize(namespace, current, feedbackMessages);
            String merged = mergeAdditive(namespace, current, synthesized);
            writeStored(namespace, merged);
            log.info("[Memory] Updated profile {} ({} -> {} chars)", namespace,
                    current != null ? current.length() : 0, merged.length());
            return merged;
        } finally {
            lock.unlock();
        }
    }

    public CompletableFuture<String> updateProfileAsync(MemoryNamespace namespace, String defaultProfile,
            List<Message> feedbackMessages) {
        return CompletableFuture.supplyAsync(() -> updateProfile(namespace, defaultProfile, feedbackMessages));
    }

    private String synthesize(MemoryNamespace namespace, String current, List<Message> feedbackMessages) {
        String result;
        try {
            result = synthesizer.synthesize(namespace, current != null ? current : "", List.copyOf(feedbackMessages));
        } catch (SynthesizerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SynthesizerException("Preference synthesis failed for " + namespace, e);
        }
        if (result == null || result.isBlank()) {
            throw new SynthesizerException("Synthesizer returned an empty profile for " + namespace);
        }
        return result;
    }

    /**
     * Guards against wholesale replacement. A result that keeps none of the
     * current profile's lines is treated as an addition and appended; anything
     * else is taken as the synthesizer's targeted amendment.
     */
    String mergeAdditive(MemoryNamespace namespace, String current, String synthesized) {
        Set<String> currentLines = nonBlankLines(current);
        if (currentLines.isEmpty()) {
            return synthesized.strip();
        }
        Set<String> newLines = nonBlankLines(synthesized);
        boolean keepsAny = currentLines.stream().anyMatch(newLines::contains);
        if (keepsAny) {
            return synthesized.strip();
        }
        log.warn("[Memory] Synthesized profile for {} shares no line with the current one, appending it",
                namespace);
        return current.strip() + "\n" + synthesized.strip();
    }

    private static Set<String> nonBlankLines(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private String readStored(MemoryNamespace namespace) {
        try {
            return storagePort.getText(PREFERENCES_DIR, profilePath(namespace)).join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to read profile " + namespace, unwrap(e));
        }
    }

    private void writeStored(MemoryNamespace namespace, String profile) {
        try {
            storagePort.putTextAtomic(PREFERENCES_DIR, profilePath(namespace), profile, true).join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to write profile " + namespace, unwrap(e));
        }
    }

    private static String profilePath(MemoryNamespace namespace) {
        return namespace.path() + PROFILE_EXTENSION;
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
