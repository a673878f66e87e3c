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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of a saga instance. This is both the persisted record and the answer to status queries.
 * {@code stepResults} keeps execution order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SagaSnapshot(
        String sagaId,
        SagaDefinition definition,
        SagaStatus status,
        FailureReason failureReason,
        String failedStepId,
        int currentStepIndex,
        Map<String, StepOutcome> stepResults,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt,
        long version
) {

    public SagaSnapshot {
        stepResults = stepResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
    }

    /** A rollback did not complete; an operator has to reconcile the remote services by hand. */
    @JsonProperty("requires_intervention")
    public boolean requiresIntervention() {
        return status == SagaStatus.COMPENSATION_FAILED;
    }

    public StepOutcome outcome(String stepId) {
        return stepResults.get(stepId);
    }

    public String sagaName() {
        return definition != null ? definition.name() : SagaDefinition.DEFAULT_NAME;
    }

    public SagaSnapshot withVersion(long newVersion) {
        return new SagaSnapshot(sagaId, definition, status, failureReason, failedStepId, currentStepIndex,
                stepResults, createdAt, startedAt, completedAt, updatedAt, newVersion);
    }
}
