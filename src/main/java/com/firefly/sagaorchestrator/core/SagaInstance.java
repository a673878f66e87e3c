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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable saga state driven by a single coordinator flow. Not thread-safe: only the flow holding the
 * saga lease touches it, and it leaves the flow as a {@link SagaSnapshot}.
 */
public final class SagaInstance {
    private final String sagaId;
    private final SagaDefinition definition;
    private final Instant createdAt;
    private final LinkedHashMap<String, StepOutcome> stepResults;
    private SagaStatus status;
    private FailureReason failureReason;
    private String failedStepId;
    private int currentStepIndex;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;
    private long version;

    private SagaInstance(String sagaId, SagaDefinition definition, SagaStatus status, Instant createdAt,
                         Map<String, StepOutcome> stepResults) {
        this.sagaId = sagaId;
        this.definition = definition;
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.stepResults = new LinkedHashMap<>(stepResults);
    }

    public static SagaInstance create(String sagaId, SagaDefinition definition, Instant now) {
        return new SagaInstance(sagaId, definition, SagaStatus.PENDING, now, Map.of());
    }

    public static SagaInstance fromSnapshot(SagaSnapshot snapshot) {
        SagaInstance instance = new SagaInstance(snapshot.sagaId(), snapshot.definition(), snapshot.status(),
                snapshot.createdAt(), snapshot.stepResults());
        instance.failureReason = snapshot.failureReason();
        instance.failedStepId = snapshot.failedStepId();
        instance.currentStepIndex = snapshot.currentStepIndex();
        instance.startedAt = snapshot.startedAt();
        instance.completedAt = snapshot.completedAt();
        instance.updatedAt = snapshot.updatedAt();
        instance.version = snapshot.version();
        return instance;
    }

    public SagaSnapshot toSnapshot() {
        return new SagaSnapshot(sagaId, definition, status, failureReason, failedStepId, currentStepIndex,
                stepResults, createdAt, startedAt, completedAt, updatedAt, version);
    }

    /**
     * Moves the saga along its lifecycle graph.
     *
     * @throws IllegalStateException when the transition would move backwards or leave a terminal state
     */
    public void transitionTo(SagaStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal saga transition " + status + " -> " + next + " for " + sagaId);
        }
        if (next == SagaStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            completedAt = now;
        }
        status = next;
        updatedAt = now;
    }

    /** Records a step outcome. Steps after the current index cannot be recorded. */
    public void record(String stepId, StepOutcome outcome, Instant now) {
        int index = definition.indexOf(stepId);
        if (index < 0 || index > currentStepIndex) {
            throw new IllegalStateException("Step '" + stepId + "' is not at or before the current step of " + sagaId);
        }
        StepOutcome previous = stepResults.get(stepId);
        if (previous != null && previous.status() == StepStatus.SUCCEEDED && outcome.status() == StepStatus.SUCCEEDED) {
            throw new IllegalStateException("Step '" + stepId + "' already succeeded in " + sagaId);
        }
        stepResults.put(stepId, outcome);
        updatedAt = now;
    }

    public void advanceTo(int index, Instant now) {
        if (index < currentStepIndex) {
            throw new IllegalStateException("Current step index cannot move backwards in " + sagaId);
        }
        currentStepIndex = index;
        updatedAt = now;
    }

    public void markFailed(FailureReason reason, String stepId) {
        this.failureReason = reason;
        this.failedStepId = stepId;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public String sagaId() { return sagaId; }
    public SagaDefinition definition() { return definition; }
    public SagaStatus status() { return status; }
    public FailureReason failureReason() { return failureReason; }
    public String failedStepId() { return failedStepId; }
    public int currentStepIndex() { return currentStepIndex; }
    public Instant createdAt() { return createdAt; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }
    public long version() { return version; }
    public String sagaName() { return definition.name(); }

    public StepOutcome outcome(String stepId) {
        return stepResults.get(stepId);
    }

    /** Read-only live view in execution order. */
    public Map<String, StepOutcome> stepResults() {
        return java.util.Collections.unmodifiableMap(stepResults);
    }
}
