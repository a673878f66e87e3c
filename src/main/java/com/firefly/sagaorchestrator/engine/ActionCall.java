/*
 * Copyright 2025 Firefly Software Solutions Inc
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
 */

package com.firefly.sagaorchestrator.engine;

import java.util.Map;

/**
 * One outbound action or compensation call.
 *
 * @param sagaId       owning saga
 * @param stepId       owning step
 * @param serviceUrl   base URL of the remote service
 * @param action       action path appended to {@code serviceUrl}
 * @param payload      materialized JSON body
 * @param compensation whether this call undoes the step
 */
public record ActionCall(
        String sagaId,
        String stepId,
        String serviceUrl,
        String action,
        Map<String, Object> payload,
        boolean compensation
) {

    /** Stable per step and direction, so a downstream service can drop replays. */
    public String idempotencyKey() {
        return compensation ? sagaId + ":" + stepId + ":compensate" : sagaId + ":" + stepId;
    }

    /** {@code service_url} and {@code action} joined by exactly one slash. */
    public String url() {
        String base = serviceUrl == null ? "" : serviceUrl;
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        String path = action == null ? "" : action;
        while (path.startsWith("/")) path = path.substring(1);
        return base + "/" + path;
    }
}
