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

package com.firefly.sagaorchestrator.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a saga: the remote action to call and, optionally, the action that undoes it.
 *
 * @param stepId              unique within the saga; key for result lookups
 * @param serviceUrl          base URL of the owning service
 * @param action              logical operation, appended to {@code serviceUrl} to form the call target
 * @param payload             request body template, may embed {@code ${...}} references
 * @param compensationAction  undo operation; null means the step is not reversible (e.g. notifications)
 * @param compensationPayload undo request body template
 * @param timeout             per-attempt deadline; null falls back to the coordinator default
 * @param retryAttempts       retries after the first attempt; null falls back to the coordinator default
 * @param idempotent          whether application failures of this action may be retried safely
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepDefinition(
        String stepId,
        String serviceUrl,
        String action,
        Map<String, Object> payload,
        String compensationAction,
        Map<String, Object> compensationPayload,
        Duration timeout,
        Integer retryAttempts,
        boolean idempotent
) {

    public StepDefinition {
        payload = freeze(payload);
        compensationPayload = freeze(compensationPayload);
    }

    @JsonIgnore
    public boolean isCompensable() {
        return compensationAction != null && !compensationAction.isBlank();
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        if (map == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
