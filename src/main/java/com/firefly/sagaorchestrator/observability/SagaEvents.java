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

package com.firefly.sagaorchestrator.observability;

import com.firefly.sagaorchestrator.core.SagaStatus;
import com.firefly.sagaorchestrator.core.StepError;

/**
 * Observability hook for saga lifecycle events.
 * Provide your own Spring bean of this type to export metrics, traces or logs.
 * A logger-based implementation is always registered: {@link SagaLoggerEvents}.
 *
 * Notes:
 * - onCompensated is invoked for both outcomes; a null error means the compensation succeeded.
 * - Implementations must not block; they run on the saga's flow.
 */
public interface SagaEvents {
    default void onSubmitted(String sagaName, String sagaId) {}
    default void onStart(String sagaName, String sagaId) {}
    /** A non-terminal saga was picked up again after a restart or an expired lease. */
    default void onResumed(String sagaName, String sagaId, SagaStatus status) {}
    default void onStatusChanged(String sagaName, String sagaId, SagaStatus from, SagaStatus to) {}

    /** Invoked when a step transitions to RUNNING. */
    default void onStepStarted(String sagaName, String sagaId, String stepId) {}
    default void onStepRetry(String sagaName, String sagaId, String stepId, int attempt, StepError error) {}
    default void onStepSuccess(String sagaName, String sagaId, String stepId, int attempts, long latencyMs) {}
    default void onStepFailed(String sagaName, String sagaId, String stepId, StepError error, int attempts, long latencyMs) {}

    default void onCompensationStarted(String sagaName, String sagaId, String stepId) {}
    default void onCompensationRetry(String sagaName, String sagaId, String stepId, int attempt) {}
    default void onCompensationSkipped(String sagaName, String sagaId, String stepId, String reason) {}
    default void onCompensated(String sagaName, String sagaId, String stepId, StepError error) {}

    /** Terminal status reached: COMPLETED, COMPENSATED or COMPENSATION_FAILED. */
    default void onCompleted(String sagaName, String sagaId, SagaStatus status) {}

    /** The store rejected or failed a write; the saga is halted until recovered. */
    default void onStoreFailure(String sagaName, String sagaId, Throwable error) {}
}
