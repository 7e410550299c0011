package me.golemcore.mailgate.port.outbound;

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
import me.golemcore.mailgate.domain.model.ApprovalRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for holding a tool call until a reviewer decides on it.
 *
 * <p>
 * The returned payload is raw: either a list whose first element is the
 * decision, a decision object, or an object keyed by suspension id. The gate
 * normalizes it.
 */
public interface ApprovalPort {

    /**
     * Publish the request and wait for the reviewer.
     *
     * @param request
     *            the held call, its policy and its display description
     * @return future that completes with the raw decision payload, or
     *         exceptionally with {@code ApprovalRejectedException} or a
     *         {@code TimeoutException} when the reviewer declined or did not
     *         answer in time
     * @throws me.golemcore.mailgate.domain.exception.StoreUnavailableException
     *             if the request could not be published
     */
    CompletableFuture<JsonNode> requestApproval(ApprovalRequest request);
}
