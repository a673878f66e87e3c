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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Recorded outcome of one step: forward execution plus, when rolled back, its compensation.
 * Immutable; state changes produce a new instance.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepOutcome(
        StepStatus status,
        Object result,
        StepError error,
        int attemptCount,
        Instant startedAt,
        Instant finishedAt,
        int compensationAttempts,
        StepError compensationError,
        Instant compensatedAt
) {

    public static StepOutcome running(Instant startedAt) {
        return new StepOutcome(StepStatus.RUNNING, null, null, 0, startedAt, null, 0, null, null);
    }

    public static StepOutcome succeeded(Object result, int attempts, Instant startedAt, Instant finishedAt) {
        return new StepOutcome(StepStatus.SUCCEEDED, result, null, attempts, startedAt, finishedAt, 0, null, null);
    }

    public static StepOutcome failed(StepError error, int attempts, Instant startedAt, Instant finishedAt) {
        return new StepOutcome(StepStatus.FAILED, null, error, attempts, startedAt, finishedAt, 0, null, null);
    }

    public StepOutcome compensating() {
        return new StepOutcome(StepStatus.COMPENSATING, result, error, attemptCount, startedAt, finishedAt,
                compensationAttempts, compensationError, compensatedAt);
    }

    public StepOutcome compensated(int attempts, Instant when) {
        return new StepOutcome(StepStatus.COMPENSATED, result, error, attemptCount, startedAt, finishedAt,
                attempts, null, when);
    }

    public StepOutcome compensationFailed(int attempts, StepError cause, Instant when) {
        return new StepOutcome(StepStatus.COMPENSATION_FAILED, result, error, attemptCount, startedAt, finishedAt,
                attempts, cause, when);
    }
}
