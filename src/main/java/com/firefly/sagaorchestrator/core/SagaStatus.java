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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a saga instance.
 * <p>
 * Transitions only move forward:
 * PENDING → RUNNING → (RUNNING | COMPLETED | COMPENSATING), COMPENSATING → (COMPENSATED | COMPENSATION_FAILED).
 * {@link #TIMED_OUT} is kept for record compatibility; a whole-saga timeout is reported through
 * {@link FailureReason#TIMED_OUT} on a compensated instance instead.
 */
public enum SagaStatus {
    PENDING,
    RUNNING,
    COMPENSATING,
    COMPLETED,
    COMPENSATED,
    COMPENSATION_FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == COMPENSATION_FAILED || this == TIMED_OUT;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(SagaStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SagaStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING);
            case RUNNING:
                return EnumSet.of(RUNNING, COMPLETED, COMPENSATING);
            case COMPENSATING:
                return EnumSet.of(COMPENSATED, COMPENSATION_FAILED);
            default:
                return EnumSet.noneOf(SagaStatus.class);
        }
    }
}
